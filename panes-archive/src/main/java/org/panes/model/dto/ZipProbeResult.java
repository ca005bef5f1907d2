package org.panes.model.dto;

/**
 * Outcome of comparing the entry count declared in a ZIP's end-of-central-directory record
 * against the entries the reader can actually deliver.
 *
 * @param declaredEntries   total-entries field of the EOCD record, or -1 when the record was not found
 * @param accessibleEntries entries readable with the credentials at hand
 */
public record ZipProbeResult(int declaredEntries, int accessibleEntries) {

    public boolean hasEncryptedEntries() {
        return declaredEntries >= 0 && declaredEntries > accessibleEntries;
    }
}
