package com.flowmable.mosaic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns every photo in the source directories into a {@link Candidate}.
 * <p>
 * One unit of work per file: load (or fetch from the thumbnail cache), crop to
 * a square per the directory's {@link CropHint}, rescale, profile. Each unit
 * writes only its own pre-sized slot, so no lock is needed; files that fail to
 * decode leave their slot empty and are dropped from the result.
 */
public class CandidatePreparer {

    private static final Logger logger = LoggerFactory.getLogger(CandidatePreparer.class);

    /**
     * A file discovered under a source directory, with that directory's crop hint.
     */
    public record SourceFile(Path path, CropHint cropHint) {}

    private final JobScheduler scheduler;
    private final RasterStore store;
    private final ColorProfiler profiler;
    private final ThumbnailCache cache;

    public CandidatePreparer(JobScheduler scheduler, RasterStore store, ColorProfiler profiler) {
        this(scheduler, store, profiler, null);
    }

    /**
     * @param cache Thumbnail cache, or {@code null} to always compute thumbnails
     */
    public CandidatePreparer(JobScheduler scheduler, RasterStore store, ColorProfiler profiler, ThumbnailCache cache) {
        this.scheduler = scheduler;
        this.store = store;
        this.profiler = profiler;
        this.cache = cache;
    }

    /**
     * Discover, load and profile every candidate photo.
     *
     * @throws ConfigurationException if a directory cannot be listed or no candidate could be prepared
     */
    public List<Candidate> prepare(List<SourceDirectory> sources, boolean recursive,
                                   int thumbnailSize, int subSamples) {
        return prepare(discover(sources, recursive), thumbnailSize, subSamples);
    }

    /**
     * List every regular file under the source directories, sorted by path
     * within each directory.
     *
     * @throws ConfigurationException if a directory cannot be listed
     */
    public static List<SourceFile> discover(List<SourceDirectory> sources, boolean recursive) {
        List<SourceFile> files = new ArrayList<>();
        for (SourceDirectory source : sources) {
            try (Stream<Path> stream = recursive ? Files.walk(source.directory()) : Files.list(source.directory())) {
                stream.filter(Files::isRegularFile)
                        .sorted(Comparator.naturalOrder())
                        .forEach(p -> files.add(new SourceFile(p, source.cropHint())));
            } catch (IOException | UncheckedIOException e) {
                throw new ConfigurationException("Cannot list source directory " + source.directory()
                        + ": " + e.getMessage(), e);
            }
        }
        return files;
    }

    /**
     * Prepare the given files in parallel.
     *
     * @return candidates in discovery order, skipping files that failed
     * @throws ConfigurationException if no candidate could be prepared
     */
    public List<Candidate> prepare(List<SourceFile> files, int thumbnailSize, int subSamples) {
        long t0 = System.nanoTime();
        if (cache != null) {
            Set<String> shared = duplicateNames(files);
            if (!shared.isEmpty()) {
                logger.warn("{} file name(s) occur in more than one source directory and will share "
                        + "a cached thumbnail: {}", shared.size(), shared);
            }
        }
        Candidate[] slots = new Candidate[files.size()];

        JobScheduler.Batch batch = scheduler.newBatch();
        for (int i = 0; i < files.size(); i++) {
            final int slot = i;
            final SourceFile file = files.get(i);
            batch.submit(() -> slots[slot] = prepareOne(file, thumbnailSize, subSamples).orElse(null));
        }
        batch.awaitAll();

        List<Candidate> candidates = new ArrayList<>(slots.length);
        for (Candidate c : slots) {
            if (c != null) candidates.add(c);
        }

        logger.info("Prepared {} of {} candidate image(s) in {} ms",
                candidates.size(), files.size(), (System.nanoTime() - t0) / 1_000_000);
        if (candidates.isEmpty()) {
            throw new ConfigurationException("No usable candidate images found among " + files.size() + " file(s)");
        }
        return candidates;
    }

    /**
     * File names that appear more than once among {@code files}, in discovery order.
     * The thumbnail cache is keyed by file name, so such files collide there.
     */
    static Set<String> duplicateNames(List<SourceFile> files) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (SourceFile file : files) {
            String name = file.path().getFileName().toString();
            if (!seen.add(name)) {
                duplicates.add(name);
            }
        }
        return duplicates;
    }

    /**
     * Build one candidate. Decode failures are absorbed here: the file is
     * logged and skipped.
     */
    Optional<Candidate> prepareOne(SourceFile file, int thumbnailSize, int subSamples) {
        String fileName = file.path().getFileName().toString();

        // 1. Cache hit bypasses crop and rescale
        BufferedImage thumbnail = cache == null ? null : cache.lookup(fileName, thumbnailSize).orElse(null);

        if (thumbnail == null) {
            // 2. Load
            BufferedImage image;
            try {
                image = store.load(file.path());
            } catch (ImageDecodeException e) {
                logger.warn("Skipping candidate: {}", e.getMessage());
                return Optional.empty();
            }

            // 3. Crop + rescale
            thumbnail = ImageOps.thumbnail(image, file.cropHint(), thumbnailSize);
            if (cache != null) {
                cache.store(fileName, thumbnail);
            }
        }

        // 4. Profile
        ColorProfile profile = profiler.profile(thumbnail, subSamples);
        return Optional.of(new Candidate(file.path(), thumbnail, profile));
    }
}
