package hidropluvial.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import hidropluvial.domain.analysis.AnalysisRun;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Escritura y lectura de resultados en JSON.
 * <p>
 * Funciona con cualquier objeto que Jackson sepa serializar; los resultados del motor
 * son records con números, cadenas y arrays planos.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe una vez configurado.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto en la ruta dada, sobrescribiendo el archivo si existe.
     *
     * @throws IOException Si falla la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * @throws IOException Si el archivo no existe o no puede parsearse.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = requireExisting(filePath);
        log.info("Deserializando {} a {}", path, objectType.getSimpleName());

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }

    /**
     * Escribe un lote de análisis como un array JSON.
     */
    public void writeRuns(List<AnalysisRun> runs, String filePath) throws IOException {
        writeToFile(runs, filePath);
    }

    public List<AnalysisRun> readRuns(String filePath) throws IOException {
        Path path = requireExisting(filePath);
        log.info("Deserializando lote de análisis desde {}", path);

        try {
            return objectMapper.readValue(path.toFile(), new TypeReference<List<AnalysisRun>>() {
            });
        } catch (IOException e) {
            log.error("Error al leer el lote de análisis desde {}", path, e);
            throw e;
        }
    }

    /**
     * Representación en texto, útil para registros y pruebas.
     */
    public String toJson(Object data) throws IOException {
        return objectMapper.writeValueAsString(data);
    }

    private static Path requireExisting(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        return path;
    }
}
