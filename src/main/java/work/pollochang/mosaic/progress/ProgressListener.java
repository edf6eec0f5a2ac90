package work.pollochang.mosaic.progress;

/**
 * 接收進度與暫停/繼續確認。所有方法預設不做事。
 */
public interface ProgressListener {

    default void onProgress(ProgressEvent event) {}

    default void onPaused() {}

    default void onResumed() {}
}
