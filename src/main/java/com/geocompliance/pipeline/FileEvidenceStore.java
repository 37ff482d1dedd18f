package com.geocompliance.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geocompliance.evidence.DocumentWriteException;
import com.geocompliance.evidence.EvidenceNotFoundException;
import com.geocompliance.evidence.EvidencePack;
import com.geocompliance.evidence.MalformedDocumentException;
import com.geocompliance.rules.RulesResult;
import com.geocompliance.synthesis.FinalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

/**
 * Directory-backed {@link EvidenceStore}.
 *
 * Layout under the base directory: {@code <id>.json} (evidence),
 * {@code <id>_rules_result.json} and {@code <id>_final_record.json}.
 * Writes go through a temporary sibling file and a move.
 */
public class FileEvidenceStore implements EvidenceStore {

    private static final Logger log = LoggerFactory.getLogger(FileEvidenceStore.class);

    private static final Pattern FEATURE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    static final String RULES_RESULT_SUFFIX = "_rules_result.json";
    static final String FINAL_RECORD_SUFFIX = "_final_record.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileEvidenceStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public EvidencePack loadEvidence(String featureId) {
        return read(featureId, evidencePath(featureId), EvidencePack.class);
    }

    @Override
    public void saveEvidence(EvidencePack evidence) {
        write(evidencePath(evidence.featureId()), evidence);
    }

    @Override
    public RulesResult loadRulesResult(String featureId) {
        return read(featureId, resolve(featureId, RULES_RESULT_SUFFIX), RulesResult.class);
    }

    @Override
    public void saveRulesResult(RulesResult result) {
        write(resolve(result.featureId(), RULES_RESULT_SUFFIX), result);
    }

    @Override
    public void saveFinalRecord(FinalRecord record) {
        write(resolve(record.featureId(), FINAL_RECORD_SUFFIX), record);
    }

    static String requireValidId(String featureId) {
        if (featureId == null || !FEATURE_ID.matcher(featureId).matches()
            || ".".equals(featureId) || "..".equals(featureId)) {
            throw new InvalidFeatureIdException(featureId);
        }
        return featureId;
    }

    private Path evidencePath(String featureId) {
        return resolve(featureId, ".json");
    }

    private Path resolve(String featureId, String suffix) {
        return directory.resolve(requireValidId(featureId) + suffix);
    }

    private <T> T read(String featureId, Path path, Class<T> type) {
        if (!Files.isRegularFile(path)) {
            throw new EvidenceNotFoundException(featureId, path.toString());
        }
        try {
            T value = objectMapper.readValue(path.toFile(), type);
            if (value == null) {
                throw new MalformedDocumentException("empty document " + path);
            }
            return value;
        } catch (JsonProcessingException ex) {
            throw new MalformedDocumentException("cannot parse " + path + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new MalformedDocumentException("cannot read " + path + ": " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new MalformedDocumentException("invalid document " + path + ": " + ex.getMessage(), ex);
        }
    }

    private void write(Path path, Object document) {
        try {
            Files.createDirectories(directory);
            Path staging = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(staging.toFile(), document);
            Files.move(staging, path, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Wrote {}", path);
        } catch (IOException ex) {
            throw new DocumentWriteException("failed to write " + path, ex);
        }
    }
}
