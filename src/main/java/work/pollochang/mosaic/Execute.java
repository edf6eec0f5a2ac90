package work.pollochang.mosaic;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.mosaic.cache.TileCache;
import work.pollochang.mosaic.composite.Compositor;
import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.core.MosaicCancelledException;
import work.pollochang.mosaic.core.MosaicException;
import work.pollochang.mosaic.core.PixelSource;
import work.pollochang.mosaic.core.TileInput;
import work.pollochang.mosaic.engine.ColorMatching;
import work.pollochang.mosaic.engine.MosaicEngine;
import work.pollochang.mosaic.engine.MosaicListener;
import work.pollochang.mosaic.engine.MosaicSettings;
import work.pollochang.mosaic.engine.NeighborDiversity;
import work.pollochang.mosaic.engine.Quality;
import work.pollochang.mosaic.extract.TileFailure;
import work.pollochang.mosaic.progress.ProgressEvent;
import work.pollochang.mosaic.report.MosaicReport;
import work.pollochang.mosaic.report.MosaicReportWriter;
import work.pollochang.mosaic.report.SettingsPresetLoader;
import work.pollochang.mosaic.tools.FileTools;
import work.pollochang.mosaic.tools.ImageLoader;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "photo-mosaic",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "照片馬賽克產生工具")
public class Execute implements Callable<Integer> {

    @Option(names = {"-s", "--source"}, required = true, description = "來源圖片。")
    private File source;

    @Option(names = {"-t", "--tile-dir"}, required = true, description = "磁磚圖片所在的目錄。")
    private File tileDir;

    @Option(names = {"-o", "--output"}, required = true, description = "輸出的 PNG 檔案。")
    private File output;

    @Option(names = {"--preset"}, description = "JSON 設定預設檔，命令列參數會覆蓋其中的值。")
    private File preset;

    @Option(names = {"-g", "--grid-size"}, description = "每邊格數 (預設: 50)。")
    private Integer gridSize;

    @Option(names = {"--tile-size"}, description = "磁磚邊長 px (預設: 32)。")
    private Integer tileSize;

    @Option(names = {"-q", "--quality"}, description = "品質: ${COMPLETION-CANDIDATES} (預設: MEDIUM)。")
    private Quality quality;

    @Option(names = {"-m", "--color-matching"}, description = "色彩比對: ${COMPLETION-CANDIDATES} (預設: LAB)。")
    private ColorMatching colorMatching;

    @Option(names = {"--neighbor-diversity"}, description = "鄰近多樣性: ${COMPLETION-CANDIDATES} (預設: ENABLED)。")
    private NeighborDiversity neighborDiversity;

    @Option(names = {"--seed"}, description = "亂數種子，指定後結果可重現。")
    private Long seed;

    @Option(names = {"--concurrency"}, description = "擷取磁磚的並行數 (預設: min(12, CPU 核心數))。")
    private Integer concurrency;

    @Option(names = {"--batch-size"}, description = "每批擷取的磁磚數 (預設: 30)。")
    private Integer batchSize;

    @Option(names = {"--high-res-tile-size"}, defaultValue = "0", description = "另外輸出高解析度版本的磁磚邊長，0 表示不輸出 (建議: 256)。")
    private int highResTileSize;

    @Option(names = {"--report"}, description = "輸出 JSON 報告的路徑。")
    private File report;

    @Override
    public Integer call() throws Exception {
        MosaicSettings settings = resolveSettings();

        log.info("========================================馬賽克參數設定========================================");
        log.info("來源圖片: {}", source.getAbsolutePath());
        log.info("磁磚目錄: {}", tileDir.getAbsolutePath());
        log.info("輸出檔案: {}", output.getAbsolutePath());
        log.info("網格: {}x{}，磁磚: {}px", settings.getGridSize(), settings.getGridSize(), settings.getTileSize());
        log.info("品質: {}，色彩比對: {}，鄰近多樣性: {}", settings.getQuality(), settings.getColorMatching(), settings.getNeighborDiversity());
        log.info("並行數: {}，批次大小: {}", settings.getConcurrency(), settings.getBatchSize());
        log.info("========================================馬賽克參數設定========================================");

        PixelSource sourcePixels = ImageLoader.loadSource(source.toPath());
        List<Path> tilePaths = ImageLoader.listImageFiles(tileDir.toPath());
        if (tilePaths.isEmpty()) {
            log.error("{} - 目錄中沒有任何圖片檔案", tileDir.getAbsolutePath());
            return 2;
        }
        List<TileInput> tiles = ImageLoader.tileInputs(tilePaths);
        log.info("找到 {} 張磁磚圖片", tiles.size());

        MosaicEngine engine = new MosaicEngine();
        MosaicResult result;
        try {
            result = engine.generate(sourcePixels, settings, tiles, new ConsoleListener());
        } catch (MosaicCancelledException e) {
            log.warn("處理已取消");
            return 3;
        } catch (MosaicException e) {
            log.error("產生馬賽克失敗: {}", e.getMessage());
            return 1;
        }

        writePng(result, output.toPath());

        if (highResTileSize > 0) {
            MosaicResult highRes = new Compositor(new TileCache())
                    .reconstructHighResolution(result, highResTileSize);
            writePng(highRes, highResPath(output.toPath()));
        }

        if (report != null) {
            new MosaicReportWriter().write(MosaicReport.of(result, settings), report.toPath());
        }

        log.info("所有任務執行完畢");
        return 0; // 成功時返回 0
    }

    MosaicSettings resolveSettings() throws IOException {
        MosaicSettings base = preset != null
                ? new SettingsPresetLoader().load(preset.toPath())
                : MosaicSettings.builder().build();

        MosaicSettings.MosaicSettingsBuilder builder = base.toBuilder();
        if (gridSize != null) builder.gridSize(gridSize);
        if (tileSize != null) builder.tileSize(tileSize);
        if (quality != null) builder.quality(quality);
        if (colorMatching != null) builder.colorMatching(colorMatching);
        if (neighborDiversity != null) builder.neighborDiversity(neighborDiversity);
        if (seed != null) builder.seed(seed);
        if (concurrency != null) builder.concurrency(concurrency);
        if (batchSize != null) builder.batchSize(batchSize);
        return builder.build().validate();
    }

    private static void writePng(MosaicResult result, Path path) throws IOException {
        FileTools.ensureDirectoryExists(path.toAbsolutePath().getParent());
        if (!ImageIO.write(result.raster(), "png", path.toFile())) {
            throw new IOException("找不到 PNG 寫入器");
        }
        log.info("{} - 已輸出 {}x{} ({})", path, result.width(), result.height(),
                FileTools.formatFileSize(path.toFile().length()));
    }

    static Path highResPath(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return output.resolveSibling(base + "-highres.png");
    }

    private static class ConsoleListener implements MosaicListener {

        private int lastLoggedPercent = -5;

        @Override
        public void onProgress(ProgressEvent event) {
            int percent = (int) event.totalProgress();
            // 每 5% 記錄一次
            if (percent / 5 != lastLoggedPercent / 5) {
                lastLoggedPercent = percent;
                log.info("[{}] {}% (已經過 {}，預估剩餘 {})", event.stageId(), percent,
                        FileTools.formatDuration(event.elapsedMs()), FileTools.formatDuration(event.remainingMs()));
            }
        }

        @Override
        public void onTileFailed(TileFailure failure) {
            log.warn("{} - {}: {}", failure.filename(), failure.outcome().getDescription(), failure.reason());
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(exitCode);
    }
}
