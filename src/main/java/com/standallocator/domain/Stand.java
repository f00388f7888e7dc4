package com.standallocator.domain;

/**
 * A physical aircraft parking position.
 * Identity only: two stands are equal when their ids are equal.
 */
public final class Stand {

    private final String standId;

    public Stand(String standId) {
        if (standId == null || standId.isBlank()) {
            throw new ConfigurationException("Stand id must not be blank");
        }
        this.standId = standId;
    }

    public String getStandId() { return standId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return standId.equals(((Stand) o).standId);
    }

    @Override
    public int hashCode() {
        return standId.hashCode();
    }

    @Override
    public String toString() {
        return "Stand{" + standId + "}";
    }
}
