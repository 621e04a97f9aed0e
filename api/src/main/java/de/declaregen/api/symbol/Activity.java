/* Copyright (C) 2024 The DeclareGen Authors
 * This file is part of DeclareGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.declaregen.api.symbol;

import java.util.Comparator;
import java.util.Objects;

import de.declaregen.exception.InvalidArgumentException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An activity label, optionally annotated with a lifecycle phase such as {@code start} or {@code complete}.
 * <p>
 * Activities are ordered by label first and lifecycle second, where a missing lifecycle sorts before any present one.
 * The textual form is {@code label} or {@code label+lifecycle}. Separators and backslashes inside the label or the
 * lifecycle are escaped with a backslash, so {@link #parse(String)} restores the activity printed by
 * {@link #toString()}.
 */
public final class Activity implements Comparable<Activity> {

    public static final char LIFECYCLE_SEPARATOR = '+';
    public static final char ESCAPE = '\\';

    private static final Comparator<Activity> ORDER = Comparator.comparing(Activity::getLabel)
            .thenComparing(Activity::getLifecycle, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String label;
    private final @Nullable String lifecycle;

    private Activity(String label, @Nullable String lifecycle) {
        this.label = label;
        this.lifecycle = lifecycle;
    }

    public static Activity of(String label) {
        return of(label, null);
    }

    public static Activity of(String label, @Nullable String lifecycle) {
        if (label == null || label.isBlank()) {
            throw new InvalidArgumentException("Activity label must not be blank");
        }
        String phase = lifecycle == null || lifecycle.isBlank() ? null : lifecycle.trim();
        return new Activity(label.trim(), phase);
    }

    /**
     * Parses the textual form produced by {@link #toString()}. The last unescaped separator splits label and
     * lifecycle. Unescaped separators before it stay part of the label, and a trailing separator belongs to the label.
     */
    public static Activity parse(String text) {
        if (text == null) {
            throw new InvalidArgumentException("Activity text must not be null");
        }
        int idx = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE) {
                i++;
            } else if (c == LIFECYCLE_SEPARATOR) {
                idx = i;
            }
        }
        if (idx <= 0 || idx == text.length() - 1) {
            return of(unescape(text));
        }
        return of(unescape(text.substring(0, idx)), unescape(text.substring(idx + 1)));
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE || c == LIFECYCLE_SEPARATOR) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String unescape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                c = text.charAt(++i);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public String getLabel() {
        return label;
    }

    public @Nullable String getLifecycle() {
        return lifecycle;
    }

    public boolean hasLifecycle() {
        return lifecycle != null;
    }

    /**
     * Returns the same activity without its lifecycle annotation.
     */
    public Activity withoutLifecycle() {
        return lifecycle == null ? this : new Activity(label, null);
    }

    @Override
    public int compareTo(Activity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Activity that = (Activity) o;
        return label.equals(that.label) && Objects.equals(lifecycle, that.lifecycle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, lifecycle);
    }

    @Override
    public String toString() {
        return lifecycle == null ? escape(label) : escape(label) + LIFECYCLE_SEPARATOR + escape(lifecycle);
    }
}
