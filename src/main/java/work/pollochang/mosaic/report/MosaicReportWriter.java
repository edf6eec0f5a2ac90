package work.pollochang.mosaic.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.mosaic.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 將 {@link MosaicReport} 寫成格式化的 JSON。
 */
@Slf4j
public class MosaicReportWriter {

    private final ObjectMapper mapper;

    public MosaicReportWriter() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    public void write(MosaicReport report, Path path) throws IOException {
        FileTools.ensureDirectoryExists(path.toAbsolutePath().getParent());
        log.info("正在將 {} 筆放置紀錄儲存至 {} ...", report.placements().size(), path);
        mapper.writeValue(path.toFile(), report);
        log.info("報告成功儲存。");
    }

    public String toJson(MosaicReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }
}
