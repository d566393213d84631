package ch.so.arp.docqa.exception;

/** Raised for uploads whose file extension cannot be extracted. */
public class UnsupportedFormatException extends ValidationException {

    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported file type: " + (extension.isEmpty() ? "(none)" : extension));
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
