package com.fieldops.application.service;

/**
 * Unknown entity type or no record with the given id.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException entity(String entity) {
        return new ResourceNotFoundException("Unknown entity: " + entity);
    }

    public static ResourceNotFoundException record(String entity, Object id) {
        return new ResourceNotFoundException(entity + " " + id + " not found");
    }
}
