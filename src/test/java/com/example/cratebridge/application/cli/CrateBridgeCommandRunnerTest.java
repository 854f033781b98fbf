package com.example.cratebridge.application.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.cratebridge.application.convert.ConversionDirection;
import com.example.cratebridge.application.convert.ConversionOptions;
import com.example.cratebridge.application.convert.ConversionReport;
import com.example.cratebridge.application.convert.LibraryConversionService;
import com.example.cratebridge.application.service.LibraryService;
import com.example.cratebridge.application.service.MigrationOptions;
import com.example.cratebridge.application.service.MigrationResult;
import com.example.cratebridge.application.service.MigrationService;
import com.example.cratebridge.common.config.AppMigrationProperties;
import com.example.cratebridge.common.exception.LibraryException;
import com.example.cratebridge.domain.enumtype.CueRetention;
import com.example.cratebridge.domain.enumtype.LibraryFormat;
import com.example.cratebridge.domain.enumtype.MissingFileHandling;
import java.nio.file.Paths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

class CrateBridgeCommandRunnerTest {

    private LibraryService libraryService;
    private LibraryConversionService libraryConversionService;
    private MigrationService migrationService;
    private CrateBridgeCommandRunner runner;

    @BeforeEach
    void setUp() {
        libraryService = mock(LibraryService.class);
        libraryConversionService = mock(LibraryConversionService.class);
        migrationService = mock(MigrationService.class);
        runner = new CrateBridgeCommandRunner(libraryService, libraryConversionService, migrationService,
                new AppMigrationProperties());
    }

    @Test
    void noCommandShouldDoNothing() throws Exception {
        runner.run(new DefaultApplicationArguments("--spring.profiles.active=dev"));

        verifyNoInteractions(libraryService, libraryConversionService, migrationService);
    }

    @Test
    void convertShouldPassDirectionAndCueFlags() throws Exception {
        when(libraryConversionService.convert(any(), any(), any(), any())).thenReturn(new ConversionReport());

        runner.run(new DefaultApplicationArguments("convert", "--source=in.nml", "--target=out.xml",
                "--map-hotcues-to-memory"));

        ArgumentCaptor<ConversionOptions> options = ArgumentCaptor.forClass(ConversionOptions.class);
        verify(libraryConversionService).convert(eq(Paths.get("in.nml")), eq(Paths.get("out.xml")),
                eq(ConversionDirection.NML_TO_REKORDBOX), options.capture());
        assertTrue(options.getValue().isMapFirstHotCueToMemory());
        assertFalse(options.getValue().isMapMemoryToHotCue());
    }

    @Test
    void convertShouldRejectFormatPairsOutsideNmlAndRekordbox() {
        LibraryException error = assertThrows(LibraryException.class,
                () -> runner.run(new DefaultApplicationArguments("convert", "--source=in.csv", "--target=out.nml")));

        assertEquals(LibraryException.UNSUPPORTED_FORMAT, error.getCode());
        verifyNoInteractions(libraryConversionService);
    }

    @Test
    void migrateShouldApplyPolicyOptions() throws Exception {
        when(migrationService.migrate(any(), any(), any(), any(), any(), any(), any()))
                .thenReturn(new MigrationResult());

        runner.run(new DefaultApplicationArguments("migrate", "--source=lib.csv", "--target=out.dat",
                "--target-format=rekordbox", "--cue-retention=keep-first-8", "--missing-files=attempt_to_locate",
                "--not-located=INCLUDE_WITH_WARNING"));

        ArgumentCaptor<MigrationOptions> options = ArgumentCaptor.forClass(MigrationOptions.class);
        verify(migrationService).migrate(eq(Paths.get("lib.csv")), eq(Paths.get("out.dat")),
                eq(LibraryFormat.CSV), eq(LibraryFormat.REKORDBOX_XML), options.capture(), any(), any());
        assertEquals(CueRetention.KEEP_FIRST_8, options.getValue().getCueRetention());
        assertEquals(MissingFileHandling.ATTEMPT_TO_LOCATE, options.getValue().getMissingFileHandling());
        assertEquals(MissingFileHandling.INCLUDE_WITH_WARNING, options.getValue().getNotLocatedFallback());
    }

    @Test
    void missingRequiredOptionShouldFail() {
        LibraryException error = assertThrows(LibraryException.class,
                () -> runner.run(new DefaultApplicationArguments("migrate", "--target=out.nml")));

        assertEquals(LibraryException.INPUT_MISSING, error.getCode());
    }
}
