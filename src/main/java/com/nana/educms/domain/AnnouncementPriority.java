package com.nana.educms.domain;

/** Urgency of an {@link Announcement}, lowest first. */
public enum AnnouncementPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
