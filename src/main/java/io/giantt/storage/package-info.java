/**
 * Workspace persistence.
 *
 * <p>Item files are loaded through {@link io.giantt.storage.FileRepository}, which resolves
 * {@code #include} chains; every write goes through {@link io.giantt.storage.AtomicFileWriter},
 * which stages temp files, keeps numbered backups and rolls back a failed batch.
 */
package io.giantt.storage;
