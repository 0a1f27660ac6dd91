package com.myla.tools;

public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }
}
