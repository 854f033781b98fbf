package com.example.cratebridge.application.cli;

import com.example.cratebridge.application.convert.ConversionDirection;
import com.example.cratebridge.application.convert.ConversionOptions;
import com.example.cratebridge.application.convert.ConversionReport;
import com.example.cratebridge.application.convert.LibraryConversionService;
import com.example.cratebridge.application.service.LibraryService;
import com.example.cratebridge.application.service.MigrationOptions;
import com.example.cratebridge.application.service.MigrationResult;
import com.example.cratebridge.application.service.MigrationService;
import com.example.cratebridge.application.service.ProgressListener;
import com.example.cratebridge.application.service.ScanResult;
import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.common.util.CancellationToken;
import com.example.cratebridge.domain.enumtype.CueRetention;
import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.MissingFileHandling;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Headless entry points:
 * <pre>
 *   scan    --folder=DIR [--folder=DIR ...] [--export=FILE]
 *   convert --source=FILE --target=FILE [--map-hotcues-to-memory] [--map-memory-to-hotcue]
 *   migrate --source=FILE --target=FILE [--source-format=F] [--target-format=F] [--folder=DIR ...]
 *           [--cue-retention=KEEP_ALL|KEEP_FIRST_8|DROP_ALL]
 *           [--missing-files=SKIP|INCLUDE_WITH_WARNING|ATTEMPT_TO_LOCATE]
 *           [--not-located=SKIP|INCLUDE_WITH_WARNING]
 *           [--map-hotcues-to-memory] [--map-memory-to-hotcue]
 * </pre>
 * Without a command the runner does nothing.
 */
@Component
public class CrateBridgeCommandRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CrateBridgeCommandRunner.class);

    static final String OPT_FOLDER = "folder";
    static final String OPT_EXPORT = "export";
    static final String OPT_SOURCE = "source";
    static final String OPT_TARGET = "target";
    static final String OPT_SOURCE_FORMAT = "source-format";
    static final String OPT_TARGET_FORMAT = "target-format";
    static final String OPT_CUE_RETENTION = "cue-retention";
    static final String OPT_MISSING_FILES = "missing-files";
    static final String OPT_NOT_LOCATED = "not-located";
    static final String OPT_HOTCUES_TO_MEMORY = "map-hotcues-to-memory";
    static final String OPT_MEMORY_TO_HOTCUE = "map-memory-to-hotcue";

    private final LibraryService libraryService;
    private final LibraryConversionService libraryConversionService;
    private final MigrationService migrationService;
    private final AppMigrationProperties appMigrationProperties;

    public CrateBridgeCommandRunner(LibraryService libraryService,
                                    LibraryConversionService libraryConversionService,
                                    MigrationService migrationService,
                                    AppMigrationProperties appMigrationProperties) {
        this.libraryService = libraryService;
        this.libraryConversionService = libraryConversionService;
        this.migrationService = migrationService;
        this.appMigrationProperties = appMigrationProperties;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.debug("No command given, nothing to do");
            return;
        }
        String command = commands.get(0).toLowerCase(Locale.ROOT);
        try {
            switch (command) {
                case "scan":
                    scan(args);
                    break;
                case "convert":
                    convert(args);
                    break;
                case "migrate":
                    migrate(args);
                    break;
                default:
                    throw new LibraryException(LibraryException.INVALID_STATE, "Unknown command: " + command,
                            "Use scan, convert or migrate");
            }
        } catch (LibraryException e) {
            log.error("COMMAND_FAILED command={} code={} message={} action={}",
                    command, e.getCode(), e.getMessage(), e.getUserAction());
            throw e;
        }
    }

    // ════════════════════════════════════════════════════════
    // Commands
    // ════════════════════════════════════════════════════════

    void scan(ApplicationArguments args) throws Exception {
        registerFolders(args);
        ScanResult result = libraryService.scanRegisteredFolders(loggingListener("scan"), CancellationToken.none());
        log.info("SCAN_COMMAND_DONE tracks={} corrupt={} canceled={}",
                result.getTracks().size(), result.getCorruptTracks(), result.isCanceled());
        String export = single(args, OPT_EXPORT, false);
        if (export != null) {
            Path target = Paths.get(export);
            libraryService.exportTo(requireFormat(LibraryFormat.fromPath(target), target), target);
        }
    }

    void convert(ApplicationArguments args) throws Exception {
        Path source = Paths.get(single(args, OPT_SOURCE, true));
        Path target = Paths.get(single(args, OPT_TARGET, true));
        LibraryFormat sourceFormat = requireFormat(LibraryFormat.fromPath(source), source);
        LibraryFormat targetFormat = requireFormat(LibraryFormat.fromPath(target), target);
        ConversionDirection direction = ConversionDirection.between(sourceFormat, targetFormat);
        if (direction == null) {
            throw new LibraryException(LibraryException.UNSUPPORTED_FORMAT,
                    "convert only handles NML and rekordbox XML, got " + sourceFormat + " -> " + targetFormat,
                    "Use migrate for other format pairs");
        }
        ConversionOptions options = new ConversionOptions(
                args.containsOption(OPT_HOTCUES_TO_MEMORY) || appMigrationProperties.isMapFirstHotCueToMemory(),
                args.containsOption(OPT_MEMORY_TO_HOTCUE) || appMigrationProperties.isMapMemoryToHotCue());
        ConversionReport report = libraryConversionService.convert(source, target, direction, options);
        log.info("CONVERT_COMMAND_DONE tracks={} playlists={} skipped={}",
                report.getTrackCount(), report.getPlaylistCount(), report.getSkipped().size());
    }

    void migrate(ApplicationArguments args) throws Exception {
        registerFolders(args);
        Path source = Paths.get(single(args, OPT_SOURCE, true));
        Path target = Paths.get(single(args, OPT_TARGET, true));
        LibraryFormat sourceFormat = formatOption(args, OPT_SOURCE_FORMAT, source);
        LibraryFormat targetFormat = formatOption(args, OPT_TARGET_FORMAT, target);

        MigrationOptions options = MigrationOptions.from(appMigrationProperties);
        String retention = single(args, OPT_CUE_RETENTION, false);
        if (retention != null) {
            options.setCueRetention(parseEnum(CueRetention.class, retention, OPT_CUE_RETENTION));
        }
        String missing = single(args, OPT_MISSING_FILES, false);
        if (missing != null) {
            options.setMissingFileHandling(parseEnum(MissingFileHandling.class, missing, OPT_MISSING_FILES));
        }
        String notLocated = single(args, OPT_NOT_LOCATED, false);
        if (notLocated != null) {
            options.setNotLocatedFallback(parseEnum(MissingFileHandling.class, notLocated, OPT_NOT_LOCATED));
        }
        if (args.containsOption(OPT_HOTCUES_TO_MEMORY)) {
            options.setMapFirstHotCueToMemory(true);
        }
        if (args.containsOption(OPT_MEMORY_TO_HOTCUE)) {
            options.setMapMemoryToHotCue(true);
        }
        MigrationResult result = migrationService.migrate(source, target, sourceFormat, targetFormat, options,
                loggingListener("migrate"), CancellationToken.none());
        log.info("MIGRATE_COMMAND_DONE phase={} read={} written={} skipped={} warnings={}",
                result.getPhase(), result.getTracksRead(), result.getTracksWritten(),
                result.getSkipped().size(), result.getWarnings().size());
    }

    // ════════════════════════════════════════════════════════
    // Argument helpers
    // ════════════════════════════════════════════════════════

    private void registerFolders(ApplicationArguments args) {
        List<String> folders = args.getOptionValues(OPT_FOLDER);
        if (folders == null) {
            return;
        }
        for (String folder : folders) {
            libraryService.addFolder(Paths.get(folder));
        }
    }

    private static String single(ApplicationArguments args, String name, boolean required) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).trim().isEmpty()) {
            if (required) {
                throw new LibraryException(LibraryException.INPUT_MISSING, "Missing option --" + name,
                        "Pass --" + name + "=<value>");
            }
            return null;
        }
        return values.get(0).trim();
    }

    private static LibraryFormat formatOption(ApplicationArguments args, String name, Path path) {
        String raw = single(args, name, false);
        if (raw == null) {
            return requireFormat(LibraryFormat.fromPath(path), path);
        }
        LibraryFormat format = LibraryFormat.fromName(raw);
        if (format == null) {
            throw new LibraryException(LibraryException.UNSUPPORTED_FORMAT, "Unknown format: " + raw,
                    "Use NML, REKORDBOX_XML, CSV or M3U");
        }
        return format;
    }

    private static LibraryFormat requireFormat(LibraryFormat format, Path path) {
        if (format == null) {
            throw new LibraryException(LibraryException.UNSUPPORTED_FORMAT,
                    "Cannot infer library format from file name: " + path,
                    "Use a .nml, .xml, .csv, .m3u or .m3u8 file");
        }
        return format;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String option) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new LibraryException(LibraryException.INVALID_STATE,
                    "Invalid value for --" + option + ": " + raw, null, e);
        }
    }

    private static ProgressListener loggingListener(String command) {
        return (percent, message, current, total) ->
                log.debug("COMMAND_PROGRESS command={} percent={} message={}", command, percent, message);
    }
}
