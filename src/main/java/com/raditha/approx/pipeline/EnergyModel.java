package com.raditha.approx.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-instruction cost table of a core.
 * <pre>
 * { "core": "rv32", "freq": 125, "insns": { "fmul.s": { "cycles": 4, "power": 1.7 } } }
 * </pre>
 * {@code freq} is in MHz and defaults to 125.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnergyModel(
        @JsonProperty("core") String core,
        @JsonProperty("freq") double freqMhz,
        @JsonProperty("insns") Map<String, InstructionCost> instructions) {

    public static final double DEFAULT_FREQ_MHZ = 125;

    private static final ObjectMapper mapper = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InstructionCost(double cycles, double power) {
    }

    public EnergyModel {
        core = core == null ? "unknown" : core;
        freqMhz = freqMhz > 0 ? freqMhz : DEFAULT_FREQ_MHZ;
        Map<String, InstructionCost> normalized = new HashMap<>();
        if (instructions != null) {
            instructions.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
        }
        instructions = Map.copyOf(normalized);
    }

    public static EnergyModel load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Energy model not found: " + file);
        }
        EnergyModel model = mapper.readValue(file.toFile(), EnergyModel.class);
        if (model == null || model.instructions().isEmpty()) {
            throw new IOException("Energy model " + file + " defines no instructions");
        }
        return model;
    }

    public double frequencyHz() {
        return freqMhz * 1e6;
    }

    public InstructionCost costOf(String mnemonic) {
        return instructions.get(mnemonic.toLowerCase(Locale.ROOT));
    }
}
