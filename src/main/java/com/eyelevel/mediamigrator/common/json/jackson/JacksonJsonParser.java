package com.eyelevel.mediamigrator.common.json.jackson;


import com.eyelevel.mediamigrator.common.json.JsonParser;
import com.eyelevel.mediamigrator.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(Path jsonFile, Class<T> valueType) {
        log.debug("Parsing JSON file '{}' to object of type: {}", jsonFile, valueType.getName());
        try (InputStream in = Files.newInputStream(jsonFile)) {
            T result = objectMapper.readValue(in, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.warn("Error parsing JSON file '{}' to object of type: {}", jsonFile, valueType.getName());
            throw new JsonParsingException("Error parsing JSON file " + jsonFile.getFileName(), e);
        }
    }
}
