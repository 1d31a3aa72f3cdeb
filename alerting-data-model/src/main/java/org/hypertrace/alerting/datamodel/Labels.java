package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, key-sorted label set. Two label sets with the same pairs always produce the same
 * {@link #stringKey()} and {@link #fingerprint()}, which is what identifies an alert instance.
 */
public final class Labels {
  public static final String ALERT_NAME_LABEL = "alertname";
  public static final String RULE_UID_LABEL = "__alert_rule_uid__";
  public static final String NAMESPACE_UID_LABEL = "__alert_rule_namespace_uid__";

  private static final Labels EMPTY = new Labels(ImmutableSortedMap.of());

  private final ImmutableSortedMap<String, String> labels;

  private Labels(ImmutableSortedMap<String, String> labels) {
    this.labels = labels;
  }

  public static Labels empty() {
    return EMPTY;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Labels of(Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return EMPTY;
    }
    return new Labels(ImmutableSortedMap.copyOf(labels));
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(labels.get(name));
  }

  public boolean isEmpty() {
    return labels.isEmpty();
  }

  @JsonValue
  public Map<String, String> asMap() {
    return labels;
  }

  /** Returns a copy with {@code other}'s pairs added, overriding keys present in both. */
  public Labels merge(Map<String, String> other) {
    if (other == null || other.isEmpty()) {
      return this;
    }
    TreeMap<String, String> merged = new TreeMap<>(labels);
    merged.putAll(other);
    return new Labels(ImmutableSortedMap.copyOfSorted(merged));
  }

  public Labels merge(Labels other) {
    return merge(other.labels);
  }

  public String stringKey() {
    return labels.toString();
  }

  public String fingerprint() {
    return Hashing.sha256().hashString(stringKey(), StandardCharsets.UTF_8).toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Labels)) {
      return false;
    }
    return labels.equals(((Labels) o).labels);
  }

  @Override
  public int hashCode() {
    return labels.hashCode();
  }

  @Override
  public String toString() {
    return stringKey();
  }
}
