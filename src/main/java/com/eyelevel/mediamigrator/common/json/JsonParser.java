package com.eyelevel.mediamigrator.common.json;

import java.nio.file.Path;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Implementations handle the details of JSON parsing using a specific JSON library.
 */
public interface JsonParser {

    /**
     * Parses a JSON file into a Java object of the specified type.
     *
     * @param jsonFile  The file holding the JSON document.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.mediamigrator.exception.json.JsonParsingException if the file cannot be read or parsed.
     */
    <T> T parseObject(Path jsonFile, Class<T> valueType);
}
