package com.nana.educms.domain;

import java.time.LocalDateTime;

/**
 * Announcement — a notice published to students and staff.
 *
 * <p>Carries no business rules of its own; it goes through the generic
 * repository like every other entity. Attachments live in their own table
 * and point back here through {@link AnnouncementAttachment#getAnnouncementId()}.
 */
public class Announcement extends BaseEntity {

    private String title = "";
    private String content = "";
    private AnnouncementCategory category = AnnouncementCategory.GENERAL;
    private AnnouncementPriority priority = AnnouncementPriority.NORMAL;
    private String authorId = "";
    private String authorName = "";
    private boolean published = true;
    private LocalDateTime publishDate;
    private LocalDateTime expiryDate;
    private String targetAudience;
    private boolean pinned;
    private int viewCount;

    public String getTitle()                       { return title; }
    public void setTitle(String title)             { this.title = title == null ? "" : title; }

    /** @return rich-text body (HTML) */
    public String getContent()                     { return content; }
    public void setContent(String content)         { this.content = content == null ? "" : content; }

    public AnnouncementCategory getCategory()      { return category; }
    public void setCategory(AnnouncementCategory category) {
        this.category = category == null ? AnnouncementCategory.GENERAL : category;
    }

    public AnnouncementPriority getPriority()      { return priority; }
    public void setPriority(AnnouncementPriority priority) {
        this.priority = priority == null ? AnnouncementPriority.NORMAL : priority;
    }

    public String getAuthorId()                    { return authorId; }
    public void setAuthorId(String authorId)       { this.authorId = authorId == null ? "" : authorId; }

    /** @return author display name, denormalised at write time */
    public String getAuthorName()                  { return authorName; }
    public void setAuthorName(String authorName)   { this.authorName = authorName == null ? "" : authorName; }

    public boolean isPublished()                   { return published; }
    public void setPublished(boolean published)    { this.published = published; }

    /** @return scheduled publication moment, or null to publish immediately */
    public LocalDateTime getPublishDate()          { return publishDate; }
    public void setPublishDate(LocalDateTime publishDate) { this.publishDate = publishDate; }

    /** @return moment the announcement stops being shown, or null for never */
    public LocalDateTime getExpiryDate()           { return expiryDate; }
    public void setExpiryDate(LocalDateTime expiryDate) { this.expiryDate = expiryDate; }

    public String getTargetAudience()              { return targetAudience; }
    public void setTargetAudience(String targetAudience) { this.targetAudience = targetAudience; }

    public boolean isPinned()                      { return pinned; }
    public void setPinned(boolean pinned)          { this.pinned = pinned; }

    public int getViewCount()                      { return viewCount; }
    public void setViewCount(int viewCount)        { this.viewCount = viewCount; }

    @Override
    public String toString() {
        return "Announcement{id=" + getId() + ", title='" + title + "', category=" + category
               + ", priority=" + priority + ", published=" + published + '}';
    }
}
