package com.potatoregistry.storage;

import com.potatoregistry.error.IntegrityException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;

/**
 * Pass-through stream that digests every byte it hands out and checks the digest and byte count
 * once the underlying stream is exhausted. A mismatch surfaces as {@link IntegrityException}
 * from the read that hits end of stream, so a consumer never finishes a corrupt transfer normally.
 */
public class VerifyingInputStream extends FilterInputStream {

    private final MessageDigest md;
    private final String expectedHash;
    private final long expectedSize;   // < 0: not checked
    private final String label;
    private long count;
    private boolean verified;

    public VerifyingInputStream(InputStream in, HashAlgo algo, String expectedHash, long expectedSize, String label) {
        super(in);
        this.md = algo.newDigest();
        this.expectedHash = expectedHash;
        this.expectedSize = expectedSize;
        this.label = label;
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b == -1) {
            verify();
        } else {
            md.update((byte) b);
            advance(1);
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, len);
        if (n == -1) {
            verify();
        } else if (n > 0) {
            md.update(b, off, n);
            advance(n);
        }
        return n;
    }

    // skipped bytes still have to be digested
    @Override
    public long skip(long n) throws IOException {
        byte[] buf = new byte[(int) Math.min(8192, Math.max(n, 1))];
        long remaining = n;
        while (remaining > 0) {
            int r = read(buf, 0, (int) Math.min(buf.length, remaining));
            if (r == -1) break;
            remaining -= r;
        }
        return n - remaining;
    }

    @Override
    public boolean markSupported() { return false; }

    @Override
    public synchronized void mark(int readlimit) {}

    @Override
    public synchronized void reset() throws IOException {
        throw new IOException("mark/reset not supported");
    }

    private void advance(int n) {
        count += n;
        if (expectedSize >= 0 && count > expectedSize) {
            throw new IntegrityException("size mismatch for " + label + ": expected=" + expectedSize + " read more");
        }
    }

    private void verify() {
        if (verified) return;
        verified = true;
        if (expectedSize >= 0 && count != expectedSize) {
            throw new IntegrityException("size mismatch for " + label + ": expected=" + expectedSize + " actual=" + count);
        }
        String actual = HashAlgo.toHex(md.digest());
        if (!actual.equalsIgnoreCase(expectedHash)) {
            throw new IntegrityException("hash mismatch for " + label + ": expected=" + expectedHash + ", actual=" + actual);
        }
    }
}
