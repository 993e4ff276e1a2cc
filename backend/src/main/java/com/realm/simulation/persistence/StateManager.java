package com.realm.simulation.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 世界存档读写
 *
 * 支持 JSON / YAML 两种格式，可选 gzip 压缩；写入先落临时文件再原子替换。
 * 读档时版本不一致只记录警告，仍然尽力加载。
 */
public class StateManager {

    private static final Logger logger = LoggerFactory.getLogger(StateManager.class);

    public static final String VERSION = "1.0.0";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path saveDirectory;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public StateManager(Path saveDirectory) {
        this.saveDirectory = saveDirectory;
        this.jsonMapper = configure(new ObjectMapper());
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = configure(new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * 保存世界状态
     *
     * @return 存档文件路径
     */
    public Path save(WorldState state, String name, SnapshotFormat format, boolean compressed) throws IOException {
        validateName(name);
        Files.createDirectories(saveDirectory);

        WorldSnapshot snapshot = new WorldSnapshot(VERSION, LocalDateTime.now().toString(), compressed, state);
        Path file = saveDirectory.resolve(format.fileName(name, compressed));
        Path temp = saveDirectory.resolve(file.getFileName() + TEMP_SUFFIX);

        try (OutputStream raw = Files.newOutputStream(temp);
             OutputStream out = compressed ? new GZIPOutputStream(raw) : raw) {
            mapper(format).writeValue(out, snapshot);
        }
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }

        logger.info("世界已保存: {} (version={}, format={}, compressed={})", file, VERSION, format, compressed);
        return file;
    }

    /**
     * 读取存档，依次尝试 name、name.ext、name.ext.gz
     */
    public WorldState load(String name, SnapshotFormat format) throws IOException {
        return readSnapshot(name, format).getWorldState();
    }

    public WorldSnapshot readSnapshot(String name, SnapshotFormat format) throws IOException {
        validateName(name);
        Path file = locate(name, format);

        SnapshotFormat actual = SnapshotFormat.detect(file.getFileName().toString());
        if (actual == null) {
            actual = format != null ? format : SnapshotFormat.JSON;
        }
        boolean compressed = file.getFileName().toString().endsWith(SnapshotFormat.GZIP_SUFFIX);

        WorldSnapshot snapshot;
        try (InputStream raw = Files.newInputStream(file);
             InputStream in = compressed ? new GZIPInputStream(raw) : raw) {
            snapshot = mapper(actual).readValue(in, WorldSnapshot.class);
        }

        String version = StringUtils.defaultIfBlank(snapshot.getVersion(), "unknown");
        if (!VERSION.equals(version)) {
            logger.warn("存档版本 {} 与当前版本 {} 不一致，继续尝试加载: {}", version, VERSION, file);
        }
        if (snapshot.getWorldState() == null) {
            throw new IOException("存档中缺少 world_state: " + file);
        }
        logger.info("世界已加载: {} (version={})", file, version);
        return snapshot;
    }

    private Path locate(String name, SnapshotFormat format) throws NoSuchFileException {
        List<Path> candidates = new ArrayList<>();
        candidates.add(saveDirectory.resolve(name));
        SnapshotFormat[] formats = format != null ? new SnapshotFormat[] {format} : SnapshotFormat.values();
        for (SnapshotFormat f : formats) {
            candidates.add(saveDirectory.resolve(f.fileName(name, false)));
            candidates.add(saveDirectory.resolve(f.fileName(name, true)));
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new NoSuchFileException("存档不存在: " + name);
    }

    /**
     * 列出存档，最新修改的在前
     */
    public List<SaveInfo> listSaves() throws IOException {
        List<SaveInfo> saves = new ArrayList<>();
        if (!Files.isDirectory(saveDirectory)) {
            return saves;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(saveDirectory)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                SnapshotFormat format = SnapshotFormat.detect(fileName);
                if (format == null || !Files.isRegularFile(file)) {
                    continue;
                }
                boolean compressed = fileName.endsWith(SnapshotFormat.GZIP_SUFFIX);
                String baseName = fileName.substring(0,
                    fileName.length() - format.fileName("", compressed).length());
                saves.add(SaveInfo.builder()
                    .name(baseName)
                    .fileName(fileName)
                    .format(format)
                    .compressed(compressed)
                    .size(Files.size(file))
                    .modifiedAt(Files.getLastModifiedTime(file).toMillis())
                    .build());
            }
        }
        saves.sort(Comparator.comparingLong(SaveInfo::getModifiedAt).reversed()
            .thenComparing(SaveInfo::getFileName));
        return saves;
    }

    /**
     * 删除指定名称的所有格式的存档
     *
     * @return 是否删除了至少一个文件
     */
    public boolean deleteSave(String name) throws IOException {
        validateName(name);
        boolean deleted = false;
        for (SnapshotFormat format : SnapshotFormat.values()) {
            deleted |= Files.deleteIfExists(saveDirectory.resolve(format.fileName(name, false)));
            deleted |= Files.deleteIfExists(saveDirectory.resolve(format.fileName(name, true)));
        }
        if (deleted) {
            logger.info("存档已删除: {}", name);
        }
        return deleted;
    }

    public Path getSaveDirectory() {
        return saveDirectory;
    }

    private ObjectMapper mapper(SnapshotFormat format) {
        return format == SnapshotFormat.YAML ? yamlMapper : jsonMapper;
    }

    private static void validateName(String name) {
        if (StringUtils.isBlank(name) || name.contains("/") || name.contains("\\") || name.contains("..")) {
            throw new IllegalArgumentException("非法的存档名: " + name);
        }
    }
}
