package slate.diag;

public enum Severity {
    ERROR, WARNING, NOTE, HELP;

    public String label() {
        return name().toLowerCase();
    }
}
