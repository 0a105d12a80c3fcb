package slate.server;

/**
 * Program text captured from a host document, starting at offset {@code start} of the host.
 */
public record Fragment(int start, String text) {

    public int end() {
        return start + text.length();
    }

    public boolean contains(int hostOffset) {
        return hostOffset >= start && hostOffset <= end();
    }
}
