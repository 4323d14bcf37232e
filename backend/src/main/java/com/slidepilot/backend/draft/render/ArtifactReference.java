package com.slidepilot.backend.draft.render;

/** Where a rendered presentation can be fetched from. */
public record ArtifactReference(String fileId, String downloadUrl) {}
