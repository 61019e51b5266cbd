package com.nana.educms.repository;

import com.nana.educms.domain.Announcement;
import com.nana.educms.domain.AnnouncementCategory;
import com.nana.educms.domain.AnnouncementPriority;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps {@link Announcement} to the {@code announcements} table. */
public class AnnouncementMapping extends EntityMapping<Announcement> {

    public AnnouncementMapping() {
        super(Announcement.class, "announcements",
                "title", "content", "category", "priority", "author_id", "author_name",
                "is_published", "publish_date", "expiry_date", "target_audience",
                "is_pinned", "view_count");
    }

    @Override
    protected Announcement newInstance() {
        return new Announcement();
    }

    @Override
    protected int bindColumns(PreparedStatement ps, Announcement a, int i) throws SQLException {
        ps.setString(i++, a.getTitle());
        ps.setString(i++, a.getContent());
        ps.setString(i++, a.getCategory().name());
        ps.setString(i++, a.getPriority().name());
        ps.setString(i++, a.getAuthorId());
        ps.setString(i++, a.getAuthorName());
        setBoolean(ps, i++, a.isPublished());
        setTimestamp(ps, i++, a.getPublishDate());
        setTimestamp(ps, i++, a.getExpiryDate());
        ps.setString(i++, a.getTargetAudience());
        setBoolean(ps, i++, a.isPinned());
        ps.setInt(i++, a.getViewCount());
        return i;
    }

    @Override
    protected void readColumns(ResultSet rs, Announcement a) throws SQLException {
        a.setTitle(rs.getString("title"));
        a.setContent(rs.getString("content"));
        a.setCategory(readEnum(rs, "category", AnnouncementCategory.class, AnnouncementCategory.GENERAL));
        a.setPriority(readEnum(rs, "priority", AnnouncementPriority.class, AnnouncementPriority.NORMAL));
        a.setAuthorId(rs.getString("author_id"));
        a.setAuthorName(rs.getString("author_name"));
        a.setPublished(readBoolean(rs, "is_published"));
        a.setPublishDate(readTimestamp(rs, "publish_date"));
        a.setExpiryDate(readTimestamp(rs, "expiry_date"));
        a.setTargetAudience(rs.getString("target_audience"));
        a.setPinned(readBoolean(rs, "is_pinned"));
        a.setViewCount(rs.getInt("view_count"));
    }
}
