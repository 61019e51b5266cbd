package com.nana.educms.domain;

/** Topic an {@link Announcement} is filed under. */
public enum AnnouncementCategory {
    GENERAL,
    ACADEMIC,
    ADMINISTRATIVE,
    EVENTS,
    EMERGENCY,
    MAINTENANCE,
    POLICY
}
