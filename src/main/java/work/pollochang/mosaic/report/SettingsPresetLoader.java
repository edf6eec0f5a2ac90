package work.pollochang.mosaic.report;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.engine.MosaicSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 從 JSON 預設檔讀取 {@link MosaicSettings}。未出現的欄位使用預設值，未知欄位忽略，
 * 列舉值不分大小寫 (例如 {@code "quality": "high"})。
 */
@Slf4j
public class SettingsPresetLoader {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    /**
     * @throws IOException 檔案不存在或格式錯誤
     * @throws IllegalArgumentException 設定值不合法
     */
    public MosaicSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("預設檔不存在: " + path);
        }
        MosaicSettings settings = mapper.readValue(path.toFile(), MosaicSettings.class);
        log.info("成功從 {} 讀取設定預設檔。", path);
        return settings.validate();
    }

    public MosaicSettings parse(String json) throws IOException {
        return mapper.readValue(json, MosaicSettings.class).validate();
    }
}
