package com.heatlite.aggregator.config;

import com.heatlite.aggregator.model.GridType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    void appliesDefaults() {
        var cfg = CommandLineOptions.parse(new String[]{"--csv", "data/in.csv"});

        assertEquals(Path.of("data/in.csv"), cfg.input());
        assertEquals(Path.of("dist/aggregates.json"), cfg.output());
        assertEquals(GridType.H3, cfg.grid());
        assertEquals(6, cfg.h3Resolution());
        assertEquals(5, cfg.h3MinResolution());
        assertEquals(0.1, cfg.binSize());
        assertEquals(0.2, cfg.maxBinSize());
        assertEquals(3, cfg.yearsPerWindow());
        assertFalse(cfg.conusOnly());
        assertEquals(50.0, cfg.maxSizeMb());
        assertEquals(50L * 1024 * 1024, cfg.maxSizeBytes());
        assertEquals(8, cfg.maxAttempts());
        assertTrue(cfg.threads() >= 1);
    }

    @Test
    void parsesEveryOption() {
        var cfg = CommandLineOptions.parse(new String[]{
            "--csv", "in.csv", "--out", "out/agg.json", "--grid", "bin",
            "--h3-res", "8", "--h3-min-res", "4", "--bin-size", "0.05", "--max-bin-size", "0.4",
            "--years-per-window", "5", "--conus-only", "--max-size-mb", "12.5",
            "--max-attempts", "3", "--threads", "2"});

        assertEquals(Path.of("out/agg.json"), cfg.output());
        assertEquals(GridType.BIN, cfg.grid());
        assertEquals(8, cfg.h3Resolution());
        assertEquals(4, cfg.h3MinResolution());
        assertEquals(0.05, cfg.binSize());
        assertEquals(0.4, cfg.maxBinSize());
        assertEquals(5, cfg.yearsPerWindow());
        assertTrue(cfg.conusOnly());
        assertEquals(12.5, cfg.maxSizeMb());
        assertEquals(3, cfg.maxAttempts());
        assertEquals(2, cfg.threads());
    }

    @Test
    void acceptsEqualsForm() {
        var cfg = CommandLineOptions.parse(new String[]{"--csv=in.csv", "--grid=bin", "--h3-res=7"});
        assertEquals(GridType.BIN, cfg.grid());
        assertEquals(7, cfg.h3Resolution());
    }

    @Test
    void csvIsRequired() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--grid", "bin"}));
    }

    @Test
    void rejectsUnknownAndMalformedOptions() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--verbose"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--grid", "s2"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--h3-res", "six"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--bin-size"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--bogus=1"}));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--years-per-window", "0"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--h3-res", "16"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--bin-size", "-0.1"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--max-size-mb", "0"}));
    }

    @Test
    void detectsHelp() {
        assertTrue(CommandLineOptions.isHelpRequested(new String[]{"--csv", "a", "--help"}));
        assertTrue(CommandLineOptions.isHelpRequested(new String[]{"-h"}));
        assertFalse(CommandLineOptions.isHelpRequested(new String[]{"--csv", "a"}));
    }

    @Test
    void helpFlagAsOptionValueIsNotHelp() {
        String[] args = {"--csv", "in.csv", "--out", "-h"};

        assertFalse(CommandLineOptions.isHelpRequested(args));
        assertEquals(Path.of("-h"), CommandLineOptions.parse(args).output());
        assertFalse(CommandLineOptions.isHelpRequested(new String[]{"--csv=--help"}));
    }

    @Test
    void conusOnlyAcceptsExplicitBoolean() {
        assertTrue(CommandLineOptions.parse(new String[]{"--csv", "a", "--conus-only=true"}).conusOnly());
        assertFalse(CommandLineOptions.parse(new String[]{"--csv", "a", "--conus-only=false"}).conusOnly());
        assertThrows(UsageException.class,
            () -> CommandLineOptions.parse(new String[]{"--csv", "a", "--conus-only=maybe"}));
    }
}
