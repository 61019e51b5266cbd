package com.nana.educms.repository;

import com.nana.educms.domain.Document;
import com.nana.educms.domain.DocumentAccessLevel;
import com.nana.educms.domain.DocumentCategory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps {@link Document} to the {@code documents} table. */
public class DocumentMapping extends EntityMapping<Document> {

    public DocumentMapping() {
        super(Document.class, "documents",
                "name", "description", "file_name", "file_url", "content_type", "file_size",
                "category", "access_level", "uploaded_by_id", "uploaded_by_name",
                "download_count", "tags", "version", "is_archived", "archived_at", "file_hash");
    }

    @Override
    protected Document newInstance() {
        return new Document();
    }

    @Override
    protected int bindColumns(PreparedStatement ps, Document d, int i) throws SQLException {
        ps.setString(i++, d.getName());
        ps.setString(i++, d.getDescription());
        ps.setString(i++, d.getFileName());
        ps.setString(i++, d.getFileUrl());
        ps.setString(i++, d.getContentType());
        ps.setLong(i++, d.getFileSize());
        ps.setString(i++, d.getCategory().name());
        ps.setString(i++, d.getAccessLevel().name());
        ps.setString(i++, d.getUploadedById());
        ps.setString(i++, d.getUploadedByName());
        ps.setInt(i++, d.getDownloadCount());
        ps.setString(i++, d.getTags());
        ps.setString(i++, d.getVersion());
        setBoolean(ps, i++, d.isArchived());
        setTimestamp(ps, i++, d.getArchivedAt());
        ps.setString(i++, d.getFileHash());
        return i;
    }

    @Override
    protected void readColumns(ResultSet rs, Document d) throws SQLException {
        d.setName(rs.getString("name"));
        d.setDescription(rs.getString("description"));
        d.setFileName(rs.getString("file_name"));
        d.setFileUrl(rs.getString("file_url"));
        d.setContentType(rs.getString("content_type"));
        d.setFileSize(rs.getLong("file_size"));
        d.setCategory(readEnum(rs, "category", DocumentCategory.class, DocumentCategory.GENERAL));
        d.setAccessLevel(readEnum(rs, "access_level", DocumentAccessLevel.class, DocumentAccessLevel.PUBLIC));
        d.setUploadedById(rs.getString("uploaded_by_id"));
        d.setUploadedByName(rs.getString("uploaded_by_name"));
        d.setDownloadCount(rs.getInt("download_count"));
        d.setTags(rs.getString("tags"));
        d.setVersion(rs.getString("version"));
        d.setArchived(readBoolean(rs, "is_archived"));
        d.setArchivedAt(readTimestamp(rs, "archived_at"));
        d.setFileHash(rs.getString("file_hash"));
    }
}
