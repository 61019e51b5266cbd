package com.nana.educms.repository;

import com.nana.educms.domain.AnnouncementAttachment;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps {@link AnnouncementAttachment} to the {@code announcement_attachments} table. */
public class AnnouncementAttachmentMapping extends EntityMapping<AnnouncementAttachment> {

    public AnnouncementAttachmentMapping() {
        super(AnnouncementAttachment.class, "announcement_attachments",
                "announcement_id", "file_name", "file_url", "content_type", "file_size", "description");
    }

    @Override
    protected AnnouncementAttachment newInstance() {
        return new AnnouncementAttachment();
    }

    @Override
    protected int bindColumns(PreparedStatement ps, AnnouncementAttachment a, int i) throws SQLException {
        setUuid(ps, i++, a.getAnnouncementId());
        ps.setString(i++, a.getFileName());
        ps.setString(i++, a.getFileUrl());
        ps.setString(i++, a.getContentType());
        ps.setLong(i++, a.getFileSize());
        ps.setString(i++, a.getDescription());
        return i;
    }

    @Override
    protected void readColumns(ResultSet rs, AnnouncementAttachment a) throws SQLException {
        a.setAnnouncementId(readUuid(rs, "announcement_id"));
        a.setFileName(rs.getString("file_name"));
        a.setFileUrl(rs.getString("file_url"));
        a.setContentType(rs.getString("content_type"));
        a.setFileSize(rs.getLong("file_size"));
        a.setDescription(rs.getString("description"));
    }
}
