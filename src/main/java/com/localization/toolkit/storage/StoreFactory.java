package com.localization.toolkit.storage;

import com.localization.toolkit.storage.exception.UnsupportedFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Picks the store class for a file from its extension and handles gzip
 * compressed files ({@code messages.ftl.gz}) transparently.
 */
public class StoreFactory {
    private static final Logger log = LoggerFactory.getLogger(StoreFactory.class);

    private static final String GZIP_SUFFIX = ".gz";

    private final Map<String, Supplier<? extends TranslationStore<?>>> formats = new LinkedHashMap<>();

    public StoreFactory() {
        register("ftl", FluentFile::new);
    }

    public void register(String extension, Supplier<? extends TranslationStore<?>> supplier) {
        formats.put(extension.toLowerCase(Locale.ROOT), supplier);
    }

    public Set<String> getExtensions() {
        return formats.keySet();
    }

    public boolean supports(String fileName) {
        String extension = extensionOf(fileName);
        return extension != null && formats.containsKey(extension);
    }

    /**
     * Creates an empty store for the given file name.
     */
    public TranslationStore<?> create(String fileName) {
        String extension = extensionOf(fileName);
        Supplier<? extends TranslationStore<?>> supplier = extension == null ? null : formats.get(extension);
        if (supplier == null) {
            throw new UnsupportedFormatException(fileName);
        }
        TranslationStore<?> store = supplier.get();
        store.setFileName(fileName);
        return store;
    }

    public TranslationStore<?> open(Path path) throws IOException {
        return parse(path.getFileName().toString(), Files.readAllBytes(path));
    }

    public TranslationStore<?> parse(String fileName, byte[] content) throws IOException {
        TranslationStore<?> store = create(fileName);
        byte[] data = isGzip(content) ? gunzip(content) : content;
        if (data != content) {
            log.debug("Decompressed {} ({} -> {} bytes)", fileName, content.length, data.length);
        }
        store.parse(data);
        return store;
    }

    /**
     * Serializes the store to {@code path}, compressing when the name ends in {@code .gz}.
     */
    public void write(TranslationStore<?> store, Path path) throws IOException {
        write(store.serialize(), path);
    }

    /**
     * Writes already serialized content, compressing when the name ends in {@code .gz}.
     */
    public void write(byte[] content, Path path) throws IOException {
        byte[] data = content;
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(GZIP_SUFFIX)) {
            data = gzip(data);
        }
        Files.write(path, data);
        log.debug("Wrote {} bytes to {}", data.length, path);
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return null;
        }
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(GZIP_SUFFIX)) {
            name = name.substring(0, name.length() - GZIP_SUFFIX.length());
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return null;
        }
        return name.substring(dot + 1);
    }

    static boolean isGzip(byte[] content) {
        return content.length >= 2
                && content[0] == (byte) GZIPInputStream.GZIP_MAGIC
                && content[1] == (byte) (GZIPInputStream.GZIP_MAGIC >> 8);
    }

    private static byte[] gunzip(byte[] content) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return in.readAllBytes();
        }
    }

    private static byte[] gzip(byte[] content) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = new GZIPOutputStream(buffer)) {
            out.write(content);
        }
        return buffer.toByteArray();
    }
}
