/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2026 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package io.pathtree.util;

import io.pathtree.PathTreeMessages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a request path into its non-empty segments and hands them out one at a time.
 * <p>
 * Empty fragments produced by leading, trailing or repeated separators are dropped, so {@code /auth//login/} yields
 * the two segments {@code auth} and {@code login}. The segment list never changes after construction, only the
 * position moves, and it only moves backwards through {@link #reset()}.
 * <p>
 * Instances are not thread safe.
 */
public final class SegmentCursor {

    public static final char PATH_SEPARATOR = '/';
    public static final String STRING_PATH_SEPARATOR = "/";

    private final List<String> segments;
    private final String rawPath;
    private int position;

    /**
     * Creates a cursor over the segments of the given path.
     *
     * @param path The path, may be empty
     */
    public SegmentCursor(final String path) {
        if (path == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("path");
        }
        this.segments = Collections.unmodifiableList(split(path));
        this.rawPath = path;
    }

    private SegmentCursor(final List<String> segments, final String rawPath) {
        this.segments = segments;
        this.rawPath = rawPath;
    }

    /**
     * Creates a cursor directly from a list of segments. The raw path of the returned cursor is the canonical
     * form of the segments.
     *
     * @param segments The segments
     * @return A new cursor positioned on the first segment
     */
    public static SegmentCursor fromSegments(final List<String> segments) {
        if (segments == null) {
            throw PathTreeMessages.MESSAGES.argumentCannotBeNull("segments");
        }
        final List<String> copy = Collections.unmodifiableList(new ArrayList<>(segments));
        return new SegmentCursor(copy, join(copy));
    }

    static List<String> split(final String path) {
        final List<String> result = new ArrayList<>();
        int start = 0;
        final int length = path.length();
        for (int i = 0; i <= length; ++i) {
            if (i == length || path.charAt(i) == PATH_SEPARATOR) {
                if (i > start) {
                    result.add(path.substring(start, i));
                }
                start = i + 1;
            }
        }
        return result;
    }

    static String join(final List<String> segments) {
        return STRING_PATH_SEPARATOR + String.join(STRING_PATH_SEPARATOR, segments);
    }

    public boolean hasNext() {
        return position < segments.size();
    }

    /**
     * Returns the segment at the current position and advances past it.
     *
     * @return The segment, or null if every segment has been consumed
     */
    public String next() {
        return hasNext() ? segments.get(position++) : null;
    }

    /**
     * @return The segment at the current position without consuming it, or null if every segment has been consumed
     */
    public String current() {
        return hasNext() ? segments.get(position) : null;
    }

    /**
     * Moves the position back to the first segment.
     *
     * @return this cursor
     */
    public SegmentCursor reset() {
        position = 0;
        return this;
    }

    /**
     * Consumes and returns every segment that has not been consumed yet. The cursor is exhausted afterwards.
     *
     * @return The remaining segments, in path order
     */
    public List<String> remainingSegments() {
        final List<String> remaining = new ArrayList<>(segments.subList(position, segments.size()));
        position = segments.size();
        return remaining;
    }

    /**
     * @return The 0-based index of the next segment to be consumed
     */
    public int position() {
        return position;
    }

    public int size() {
        return segments.size();
    }

    public List<String> getSegments() {
        return segments;
    }

    /**
     * @return A new cursor over the same segments, positioned on the first one
     */
    public SegmentCursor copy() {
        return new SegmentCursor(segments, rawPath);
    }

    /**
     * @return The string this cursor was created from
     */
    public String getRawPath() {
        return rawPath;
    }

    /**
     * @return The canonical form of the path, a separator followed by the segments joined with separators
     */
    public String getPath() {
        return join(segments);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SegmentCursor)) {
            return false;
        }
        return segments.equals(((SegmentCursor) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return getPath();
    }
}
