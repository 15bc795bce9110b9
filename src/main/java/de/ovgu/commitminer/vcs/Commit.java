package de.ovgu.commitminer.vcs;

import java.util.Comparator;
import java.util.Objects;

/**
 * A commit of the mined history: its hash and its position in the chronological order of that history (0 = oldest).
 */
public final class Commit {
    public static final Comparator<Commit> ORDER_BY_POSITION = Comparator.comparingInt(Commit::getPosition);

    private final String id;
    private final int position;

    public Commit(String id, int position) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Commit id must not be empty");
        }
        this.id = id;
        this.position = position;
    }

    public String getId() {
        return id;
    }

    public int getPosition() {
        return position;
    }

    /**
     * @return The first 8 characters of the hash, for log messages
     */
    public String shortId() {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Commit)) return false;
        Commit other = (Commit) o;
        return position == other.position && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, position);
    }

    @Override
    public String toString() {
        return "#" + position + " " + shortId();
    }
}
