package tidalharmonics.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lee y escribe los datos de referencia (catálogo de constituyentes, estaciones)
 * en formato JSON, desde el sistema de ficheros o desde el classpath.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Los ficheros de estaciones traen campos informativos que no modelamos
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo existe, se sobrescribe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un recurso del classpath.
     *
     * @param resourceName Nombre del recurso (ej: "constituents.json").
     * @throws IOException Si el recurso no existe o su contenido no es válido.
     */
    public <T> T readFromClasspath(String resourceName, Class<T> objectType) throws IOException {
        log.debug("Deserializando recurso {} a un objeto de tipo {}", resourceName, objectType.getSimpleName());

        try (InputStream in = JsonFileHandler.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new IOException("El recurso especificado no existe en el classpath: " + resourceName);
            }
            return objectMapper.readValue(in, objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el recurso JSON {}", resourceName, e);
            throw e;
        }
    }
}
