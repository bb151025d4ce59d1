package com.baykanat.health.store.infrastructure.storage;

import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.SeekableInputStream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Hadoop FileSystem'e gitmeden yerel dosyadan Parquet okuma. */
final class NioInputFile implements InputFile {

    private final Path file;

    NioInputFile(Path file) {
        this.file = file;
    }

    @Override
    public long getLength() throws IOException {
        return Files.size(file);
    }

    @Override
    public SeekableInputStream newStream() throws IOException {
        return new ChannelInputStream(FileChannel.open(file, StandardOpenOption.READ));
    }

    @Override
    public String toString() {
        return file.toString();
    }

    /** Pozisyonlu okuma; seek sadece pozisyonu taşır. */
    private static final class ChannelInputStream extends SeekableInputStream {

        private final FileChannel channel;
        private long pos;

        private ChannelInputStream(FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public int read() throws IOException {
            ByteBuffer one = ByteBuffer.allocate(1);
            int n = channel.read(one, pos);
            if (n <= 0) {
                return -1;
            }
            pos += n;
            return one.get(0) & 0xFF;
        }

        @Override
        public int read(byte[] bytes, int off, int len) throws IOException {
            int n = channel.read(ByteBuffer.wrap(bytes, off, len), pos);
            if (n > 0) {
                pos += n;
            }
            return n;
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            int n = channel.read(dst, pos);
            if (n > 0) {
                pos += n;
            }
            return n;
        }

        @Override
        public void readFully(byte[] bytes) throws IOException {
            readFully(bytes, 0, bytes.length);
        }

        @Override
        public void readFully(byte[] bytes, int off, int len) throws IOException {
            readFully(ByteBuffer.wrap(bytes, off, len));
        }

        @Override
        public void readFully(ByteBuffer dst) throws IOException {
            while (dst.hasRemaining()) {
                if (read(dst) < 0) {
                    throw new EOFException("Unexpected end of file at position " + pos);
                }
            }
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void seek(long newPos) {
            this.pos = newPos;
        }

        @Override
        public int available() throws IOException {
            long remaining = channel.size() - pos;
            return remaining > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) Math.max(remaining, 0);
        }

        @Override
        public void close() throws IOException {
            channel.close();
        }
    }
}
