package org.caureq.caureqalertdesk.engine;

public class NotFoundException extends RuntimeException {
    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public static NotFoundException alert(String id) { return new NotFoundException("alert", id); }
    public static NotFoundException rule(String id) { return new NotFoundException("rule", id); }

    public String resource() { return resource; }
    public String id() { return id; }
}
