package fr.lapetina.llm.tuner.infrastructure.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.tuner.evaluate.Datasets;
import fr.lapetina.llm.tuner.evaluate.UnsupportedDatasetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads datasets and writes run summaries as JSON.
 *
 * A dataset file is a JSON array of examples in any shape {@link Datasets#format}
 * accepts.
 */
public final class DatasetReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetReader.class);

    private final ObjectMapper objectMapper;

    public DatasetReader() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Reads and normalizes a dataset file.
     *
     * @throws UncheckedIOException        if the file cannot be read or is not JSON
     * @throws UnsupportedDatasetException if the content is not a supported dataset
     */
    public List<Map<String, Object>> read(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            List<Map<String, Object>> dataset = read(is);
            log.info("Dataset loaded: path={}, examples={}", path, dataset.size());
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset: " + path, e);
        }
    }

    public List<Map<String, Object>> read(InputStream inputStream) throws IOException {
        Object content = objectMapper.readValue(inputStream, Object.class);
        if (!(content instanceof List<?> list)) {
            throw new UnsupportedDatasetException("Dataset must be a JSON array");
        }
        return Datasets.format(list);
    }

    /**
     * Parses a dataset from a JSON string.
     */
    public List<Map<String, Object>> parse(String json) {
        try {
            List<Object> content = objectMapper.readValue(json, new TypeReference<List<Object>>() { });
            return Datasets.format(content);
        } catch (JsonProcessingException e) {
            throw new UnsupportedDatasetException("Dataset is not a JSON array: " + e.getOriginalMessage());
        }
    }

    /**
     * Writes any value as indented JSON.
     */
    public void write(Path path, Object value) {
        try {
            objectMapper.writeValue(path.toFile(), value);
            log.info("Written: path={}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write: " + path, e);
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
