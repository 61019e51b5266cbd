package com.nana.educms.domain;

/** Library section a {@link Document} belongs to. */
public enum DocumentCategory {
    GENERAL,
    ACADEMIC,
    ADMINISTRATIVE,
    POLICY,
    FORMS,
    REPORTS,
    PRESENTATIONS,
    IMAGES,
    VIDEOS,
    AUDIO
}
