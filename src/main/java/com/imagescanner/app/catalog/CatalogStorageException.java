package com.imagescanner.app.catalog;

/**
 * Falha de escrita/leitura no catálogo. Fatal para o lote atual e, por padrão, para o scan.
 */
public class CatalogStorageException extends RuntimeException {

    public CatalogStorageException(String message) {
        super(message);
    }

    public CatalogStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
