package org.prisma.datapipeline.resources.frames;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.BaselineTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;

import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.FrameFormat;
import org.prisma.datapipeline.api.frames.IFrameEnumerator;
import org.prisma.datapipeline.api.job.FrameRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Enumerates frames from a directory of detector images.
 * <p>
 * Files are visited in lexicographic file-name order, which is the acquisition order detector
 * software produces. Every frame of every file gets the next global index, whether or not it
 * is selected, so indices stay stable when the requested range changes:
 * <ul>
 *   <li>{@code .tif}/{@code .tiff}: one frame per page</li>
 *   <li>{@code .ge1}..{@code .ge5} (also {@code .edf.ge*}): {@code (size - header) / frameBytes} frames</li>
 * </ul>
 * A TIFF whose page count cannot be read is counted as a single frame; decoding it later fails
 * as an ordinary frame-level error instead of shifting every following index.
 * <p>
 * <b>Thread safety:</b> stateless after construction.
 */
public class DirectoryFrameEnumerator implements IFrameEnumerator {

    private static final Logger log = LoggerFactory.getLogger(DirectoryFrameEnumerator.class);

    private static final DateTimeFormatter TIFF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private final boolean readTimestamps;
    private final GeGeometry geGeometry;

    /**
     * @param options the {@code prisma.frames} configuration block.
     */
    public DirectoryFrameEnumerator(Config options) {
        this.readTimestamps = options.hasPath("readTimestamps") && options.getBoolean("readTimestamps");
        this.geGeometry = GeGeometry.fromConfig(options);
    }

    @Override
    public List<FrameDescriptor> enumerate(Path source, FrameRange range) throws IOException {
        if (!Files.isDirectory(source)) {
            throw new IOException("Frame source is not a directory: " + source);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(source)) {
            files = listing
                .filter(Files::isRegularFile)
                .filter(p -> FrameFormat.fromFileName(p.getFileName().toString()) != null)
                .sorted()
                .collect(Collectors.toList());
        }

        List<FrameDescriptor> selected = new ArrayList<>();
        int globalIndex = 0;
        for (Path file : files) {
            if (!range.isOpenEnded() && globalIndex >= range.end()) {
                break;
            }
            FrameFormat format = FrameFormat.fromFileName(file.getFileName().toString());
            int frameCount;
            List<Long> timestamps = List.of();
            if (format == FrameFormat.GE_RAW) {
                frameCount = geGeometry.frameCount(Files.size(file));
            } else {
                TiffInfo info = inspectTiff(file);
                frameCount = info.pages;
                timestamps = info.timestamps;
                if (frameCount > 1) {
                    format = FrameFormat.TIFF_STACK;
                }
            }

            for (int offset = 0; offset < frameCount; offset++, globalIndex++) {
                if (range.selects(globalIndex)) {
                    Long timestamp = offset < timestamps.size() ? timestamps.get(offset) : null;
                    selected.add(new FrameDescriptor(globalIndex, file.toAbsolutePath().toString(), offset,
                        format, timestamp));
                }
            }
        }
        log.debug("Enumerated {} frames ({} selected) from {} files in {}", globalIndex, selected.size(),
            files.size(), source);
        return selected;
    }

    private TiffInfo inspectTiff(Path file) {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                log.warn("No image reader for {}, counting it as one frame", file.getFileName());
                return new TiffInfo(1, List.of());
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, false, !readTimestamps);
                int pages = Math.max(1, reader.getNumImages(true));
                List<Long> timestamps = new ArrayList<>();
                if (readTimestamps) {
                    for (int page = 0; page < pages; page++) {
                        timestamps.add(readDateTime(reader.getImageMetadata(page)));
                    }
                }
                return new TiffInfo(pages, timestamps);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("Cannot read page count of {}, counting it as one frame: {}", file.getFileName(), e.getMessage());
            return new TiffInfo(1, List.of());
        }
    }

    private static Long readDateTime(IIOMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            TIFFDirectory directory = TIFFDirectory.createFromMetadata(metadata);
            TIFFField field = directory.getTIFFField(BaselineTIFFTagSet.TAG_DATE_TIME);
            if (field == null) {
                return null;
            }
            LocalDateTime dateTime = LocalDateTime.parse(field.getAsString(0).trim(), TIFF_DATE_TIME);
            return dateTime.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        } catch (DateTimeParseException | IllegalArgumentException | IIOInvalidTreeException e) {
            log.debug("Unreadable TIFF DateTime tag: {}", e.getMessage());
            return null;
        }
    }

    private record TiffInfo(int pages, List<Long> timestamps) {}
}
