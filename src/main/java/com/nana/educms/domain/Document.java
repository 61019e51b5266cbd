package com.nana.educms.domain;

import java.time.LocalDateTime;

/**
 * Document — a file in the document library.
 */
public class Document extends BaseEntity {

    private String name = "";
    private String description;
    private String fileName = "";
    private String fileUrl = "";
    private String contentType = "";
    private long fileSize;
    private DocumentCategory category = DocumentCategory.GENERAL;
    private DocumentAccessLevel accessLevel = DocumentAccessLevel.PUBLIC;
    private String uploadedById = "";
    private String uploadedByName = "";
    private int downloadCount;
    private String tags;
    private String version = "1.0";
    private boolean archived;
    private LocalDateTime archivedAt;
    private String fileHash;

    public String getName()                          { return name; }
    public void setName(String name)                 { this.name = name == null ? "" : name; }

    public String getDescription()                   { return description; }
    public void setDescription(String description)   { this.description = description; }

    /** @return original file name at upload time */
    public String getFileName()                      { return fileName; }
    public void setFileName(String fileName)         { this.fileName = fileName == null ? "" : fileName; }

    public String getFileUrl()                       { return fileUrl; }
    public void setFileUrl(String fileUrl)           { this.fileUrl = fileUrl == null ? "" : fileUrl; }

    public String getContentType()                   { return contentType; }
    public void setContentType(String contentType)   { this.contentType = contentType == null ? "" : contentType; }

    public long getFileSize()                        { return fileSize; }
    public void setFileSize(long fileSize)           { this.fileSize = fileSize; }

    public DocumentCategory getCategory()            { return category; }
    public void setCategory(DocumentCategory category) {
        this.category = category == null ? DocumentCategory.GENERAL : category;
    }

    public DocumentAccessLevel getAccessLevel()      { return accessLevel; }
    public void setAccessLevel(DocumentAccessLevel accessLevel) {
        this.accessLevel = accessLevel == null ? DocumentAccessLevel.PUBLIC : accessLevel;
    }

    public String getUploadedById()                  { return uploadedById; }
    public void setUploadedById(String uploadedById) { this.uploadedById = uploadedById == null ? "" : uploadedById; }

    public String getUploadedByName()                { return uploadedByName; }
    public void setUploadedByName(String uploadedByName) {
        this.uploadedByName = uploadedByName == null ? "" : uploadedByName;
    }

    public int getDownloadCount()                    { return downloadCount; }
    public void setDownloadCount(int downloadCount)  { this.downloadCount = downloadCount; }

    /** @return comma-separated search tags, or null */
    public String getTags()                          { return tags; }
    public void setTags(String tags)                 { this.tags = tags; }

    public String getVersion()                       { return version; }
    public void setVersion(String version)           { this.version = version == null ? "1.0" : version; }

    public boolean isArchived()                      { return archived; }
    public void setArchived(boolean archived)        { this.archived = archived; }

    public LocalDateTime getArchivedAt()             { return archivedAt; }
    public void setArchivedAt(LocalDateTime archivedAt) { this.archivedAt = archivedAt; }

    /** @return checksum of the stored file, or null if not computed */
    public String getFileHash()                      { return fileHash; }
    public void setFileHash(String fileHash)         { this.fileHash = fileHash; }

    @Override
    public String toString() {
        return "Document{id=" + getId() + ", name='" + name + "', category=" + category
               + ", accessLevel=" + accessLevel + ", version='" + version + "'}";
    }
}
