package com.msb.serializer;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Location in a serialized form, held as a parent link plus one unescaped segment so that
 * building a child costs the same at any depth. The JSON Pointer text ({@code #/friend/pets/0})
 * is produced only by {@link #toString()}, for markers and error paths.
 */
final class Pointer {

    static final Pointer ROOT = new Pointer(null, null);

    private final Pointer parent;
    private final String segment;
    private final int depth;
    private final int hash;

    private Pointer(Pointer parent, String segment) {
        this.parent = parent;
        this.segment = segment;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.hash = parent == null ? 0 : 31 * parent.hash + segment.hashCode();
    }

    Pointer child(String segment) {
        return new Pointer(this, segment);
    }

    Pointer child(int index) {
        return new Pointer(this, String.valueOf(index));
    }

    /**
     * Parses pointer text such as {@code #/members/a~1b}.
     *
     * @return the pointer, or null if the text does not start at the document root
     */
    static Pointer parse(String text) {
        if (SerializedForm.ROOT.equals(text)) {
            return ROOT;
        }
        if (text == null || !text.startsWith(SerializedForm.ROOT + "/")) {
            return null;
        }
        Pointer p = ROOT;
        for (String segment : text.substring(2).split("/", -1)) {
            p = p.child(unescape(segment));
        }
        return p;
    }

    static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }

    static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pointer that)) return false;
        Pointer a = this;
        Pointer b = that;
        if (a.depth != b.depth || a.hash != b.hash) return false;
        while (a != b) {
            if (!a.segment.equals(b.segment)) return false;
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        Deque<String> segments = new ArrayDeque<>(depth);
        for (Pointer p = this; p.parent != null; p = p.parent) {
            segments.push(p.segment);
        }
        StringBuilder sb = new StringBuilder(SerializedForm.ROOT);
        for (String s : segments) {
            sb.append('/').append(escape(s));
        }
        return sb.toString();
    }
}
