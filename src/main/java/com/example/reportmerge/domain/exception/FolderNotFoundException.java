package com.example.reportmerge.domain.exception;

/**
 * Raised when a processing request names a data folder that does not exist.
 */
public class FolderNotFoundException extends DomainException {

	/**
	 * @param folderPath folder path as supplied by the caller
	 */
    public FolderNotFoundException(String folderPath) {
        super("Folder not found: " + folderPath);
    }
}
