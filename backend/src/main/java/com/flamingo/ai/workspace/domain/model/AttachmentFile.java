package com.flamingo.ai.workspace.domain.model;

/**
 * Local file attached to an artifact and copied into its storage folder.
 *
 * @param fileName name under {@code attachment_files/}
 * @param filePath local path to read the bytes from
 */
public record AttachmentFile(String fileName, String filePath) {}
