package com.landrecords.ec.model;

/**
 * A fully resolved (district, taluka, hobli, village) leaf. Never persisted.
 */
public record SearchTarget(
        int districtCode,
        int talukaCode,
        int hobliCode,
        int villageCode,
        String districtName,
        String talukaName,
        String hobliName,
        String villageName) {

    public Key key() {
        return new Key(districtCode, talukaCode, hobliCode, villageCode);
    }

    public String label() {
        return districtName + " / " + talukaName + " / " + hobliName + " / " + villageName;
    }

    /** Code-only identity used for deduplication. */
    public record Key(int districtCode, int talukaCode, int hobliCode, int villageCode) {}
}
