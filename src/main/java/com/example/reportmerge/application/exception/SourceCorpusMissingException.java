package com.example.reportmerge.application.exception;

/**
 * Thrown when a data folder holds no report corpus file to merge the PDFs against.
 */
public class SourceCorpusMissingException extends ApplicationException {

	/**
	 * @param folder folder that was searched
	 * @param suffix file name suffix the corpus is expected to carry
	 */
    public SourceCorpusMissingException(String folder, String suffix) {
        super("No *" + suffix + " file found in " + folder);
    }
}
