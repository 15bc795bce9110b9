package de.ovgu.commitminer.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Analysis findings for one file content: how many violations of each rule the analyzer reported.
 */
@JsonIgnoreProperties(value = {"violationCount", "fileCount"}, allowGetters = true)
public final class CacheEntry {
    public static final CacheEntry NO_VIOLATIONS = new CacheEntry(Collections.<String, Integer>emptyMap());

    private final SortedMap<String, Integer> violationsByRule;
    private final int violationCount;

    @JsonCreator
    public CacheEntry(@JsonProperty("violationsByRule") Map<String, Integer> violationsByRule) {
        TreeMap<String, Integer> copy = new TreeMap<>();
        int total = 0;
        if (violationsByRule != null) {
            for (Map.Entry<String, Integer> e : violationsByRule.entrySet()) {
                int count = e.getValue() == null ? 0 : e.getValue();
                if (count < 0) {
                    throw new IllegalArgumentException("Negative violation count for rule " + e.getKey() + ": " + count);
                }
                if (count == 0) continue;
                copy.put(e.getKey(), count);
                total += count;
            }
        }
        this.violationsByRule = Collections.unmodifiableSortedMap(copy);
        this.violationCount = total;
    }

    @JsonProperty("violationsByRule")
    public SortedMap<String, Integer> getViolationsByRule() {
        return violationsByRule;
    }

    @JsonProperty("violationCount")
    public int getViolationCount() {
        return violationCount;
    }

    /**
     * @return What the file contributes to the file count of a commit, which is always 1
     */
    @JsonProperty("fileCount")
    public int getFileCount() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheEntry)) return false;
        return violationsByRule.equals(((CacheEntry) o).violationsByRule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(violationsByRule);
    }

    @Override
    public String toString() {
        return violationCount + " violations " + violationsByRule;
    }
}
