package io.btreeset.collections.btree;

import java.util.Comparator;

// unsigned bytes, shorter prefix first
public enum Lexicographic implements Comparator<byte[]> {
    INSTANCE;

    @Override
    public int compare(byte[] a, byte[] b) {
        final int n = Math.min(a.length, b.length);
        for (int i = 0; i < n; i++) {
            final int c = Integer.compare(Byte.toUnsignedInt(a[i]), Byte.toUnsignedInt(b[i]));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.length, b.length);
    }
}
