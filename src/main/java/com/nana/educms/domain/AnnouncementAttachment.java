package com.nana.educms.domain;

import java.util.UUID;

/**
 * A file attached to an {@link Announcement}.
 *
 * <p>The owning announcement is referenced by id only; hard-deleting the
 * announcement cascades to its attachment rows at the store level.
 */
public class AnnouncementAttachment extends BaseEntity {

    private UUID announcementId;
    private String fileName = "";
    private String fileUrl = "";
    private String contentType = "";
    private long fileSize;
    private String description;

    public AnnouncementAttachment() {
    }

    public AnnouncementAttachment(UUID announcementId, String fileName, String fileUrl,
                                  String contentType, long fileSize) {
        this.announcementId = announcementId;
        setFileName(fileName);
        setFileUrl(fileUrl);
        setContentType(contentType);
        this.fileSize = fileSize;
    }

    public UUID getAnnouncementId()                     { return announcementId; }
    public void setAnnouncementId(UUID announcementId)  { this.announcementId = announcementId; }

    public String getFileName()                         { return fileName; }
    public void setFileName(String fileName)            { this.fileName = fileName == null ? "" : fileName; }

    public String getFileUrl()                          { return fileUrl; }
    public void setFileUrl(String fileUrl)              { this.fileUrl = fileUrl == null ? "" : fileUrl; }

    /** @return MIME type, e.g. "application/pdf" */
    public String getContentType()                      { return contentType; }
    public void setContentType(String contentType)      { this.contentType = contentType == null ? "" : contentType; }

    /** @return size in bytes */
    public long getFileSize()                           { return fileSize; }
    public void setFileSize(long fileSize)              { this.fileSize = fileSize; }

    public String getDescription()                      { return description; }
    public void setDescription(String description)      { this.description = description; }

    @Override
    public String toString() {
        return "AnnouncementAttachment{id=" + getId() + ", announcementId=" + announcementId
               + ", fileName='" + fileName + "', size=" + fileSize + '}';
    }
}
