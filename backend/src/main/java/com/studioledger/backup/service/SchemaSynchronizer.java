package com.studioledger.backup.service;

/**
 * Brings the database schema up to date with the running application.
 */
public interface SchemaSynchronizer {

    void synchronize();
}
