package com.nana.educms.domain;

/** Who may see a {@link Document}, least restrictive first. */
public enum DocumentAccessLevel {
    PUBLIC,
    INTERNAL,
    RESTRICTED,
    CONFIDENTIAL
}
