package dev.pekelund.wastelog.analyzer;

import dev.pekelund.wastelog.reconciliation.ReconciliationResult;
import dev.pekelund.wastelog.reconciliation.ValueReconciler;
import dev.pekelund.wastelog.storage.WasteEntryStore;
import dev.pekelund.wastelog.waste.NewWasteEntry;
import dev.pekelund.wastelog.waste.WasteEntry;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import org.springframework.util.unit.DataSize;

/**
 * Logs an uploaded waste photo: validates and stores the upload, analyzes it, aligns its values
 * with earlier photos of the same image and persists the resulting entry.
 */
public class WasteIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(WasteIngestionService.class);

    static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "heic", "heif", "bmp");

    private final WasteImageAnalyzer analyzer;
    private final WasteEntryStore store;
    private final ValueReconciler reconciler;
    private final UploadedImageStore uploadedImageStore;
    private final Clock clock;
    private final DataSize maxImageSize;

    public WasteIngestionService(WasteImageAnalyzer analyzer, WasteEntryStore store, ValueReconciler reconciler,
        UploadedImageStore uploadedImageStore, Clock clock, DataSize maxImageSize) {
        this.analyzer = analyzer;
        this.store = store;
        this.reconciler = reconciler;
        this.uploadedImageStore = uploadedImageStore;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.maxImageSize = maxImageSize != null ? maxImageSize : DataSize.ofMegabytes(10);
    }

    public IngestionResult ingest(byte[] imageBytes, String fileName, String contentType) {
        try (WasteProcessingMdc.Context ignored = WasteProcessingMdc.open()) {
            WasteProcessingMdc.setStage("validate");
            String mimeType = validate(imageBytes, fileName, contentType);

            String imageHash = UploadedImageStore.calculateSha256Hash(imageBytes);
            WasteProcessingMdc.attachImageHash(imageHash);

            WasteProcessingMdc.setStage("upload");
            String imagePath = uploadedImageStore.save(imageBytes, fileName);
            try {
                return analyzeAndPersist(imageBytes, fileName, mimeType, imageHash, imagePath);
            } catch (RuntimeException ex) {
                // no entry references the upload
                uploadedImageStore.delete(imagePath);
                throw ex;
            }
        }
    }

    private IngestionResult analyzeAndPersist(byte[] imageBytes, String fileName, String mimeType, String imageHash,
        String imagePath) {
        WasteProcessingMdc.setStage("analyze");
        WasteAnalysis analysis = analyzer.analyze(imageBytes, fileName, mimeType);

        WasteProcessingMdc.setStage("reconcile");
        WasteEntry prior = store.findMostRecentByHash(imageHash).orElse(null);
        ReconciliationResult reconciliation = reconciler.reconcile(analysis.items(), prior);
        WasteAnalysis reconciled = analysis.withReconciledValues(reconciliation.items(),
            reconciliation.totalEstimatedValue());

        WasteProcessingMdc.setStage("persist");
        NewWasteEntry newEntry = new NewWasteEntry(
            imagePath,
            OffsetDateTime.now(clock),
            reconciled.estimatedWaste().weight(),
            joinNotes(analysis.notes(), reconciliation.consistencyNote()),
            imageHash,
            reconciliation.duplicateOfEntryId(),
            reconciliation.consistencyNote(),
            reconciliation.totalEstimatedValue()
        );
        WasteEntry entry = store.append(newEntry, reconciliation.items());

        if (reconciliation.isDuplicate()) {
            LOGGER.info("Logged waste entry #{} as a repeat of entry #{}", entry.id(),
                reconciliation.duplicateOfEntryId());
        } else {
            LOGGER.info("Logged waste entry #{} from a new image", entry.id());
        }
        return new IngestionResult(reconciled, entry);
    }

    private String validate(byte[] imageBytes, String fileName, String contentType) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new InvalidWasteImageException("No image file provided");
        }
        if (imageBytes.length > maxImageSize.toBytes()) {
            throw new InvalidWasteImageException("Image exceeds the maximum size of %d MB"
                .formatted(maxImageSize.toMegabytes()));
        }
        if (StringUtils.hasText(contentType) && contentType.toLowerCase(Locale.ROOT).startsWith("image/")) {
            return contentType;
        }
        String extension = StringUtils.getFilenameExtension(fileName);
        if (extension != null && IMAGE_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT))) {
            return mimeTypeForExtension(extension.toLowerCase(Locale.ROOT));
        }
        throw new InvalidWasteImageException("Only image files are allowed");
    }

    private static String mimeTypeForExtension(String extension) {
        return switch (extension) {
            case "jpg", "jpeg" -> "image/jpeg";
            default -> "image/" + extension;
        };
    }

    static String joinNotes(String notes, String consistencyNote) {
        return Stream.of(notes, consistencyNote)
            .filter(StringUtils::hasText)
            .map(String::trim)
            .collect(Collectors.joining(" "));
    }
}
