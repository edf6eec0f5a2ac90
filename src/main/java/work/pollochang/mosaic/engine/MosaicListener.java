package work.pollochang.mosaic.engine;

import work.pollochang.mosaic.composite.MosaicResult;
import work.pollochang.mosaic.core.MosaicException;
import work.pollochang.mosaic.extract.TileFailure;
import work.pollochang.mosaic.progress.ProgressListener;

/**
 * 產生流程的事件接收者。
 * <p>
 * 每次流程保證恰好呼叫一次 {@link #onCompleted}、{@link #onCancelled} 或 {@link #onError} 其中之一。
 * 其餘事件為單向通知。所有方法預設不做事。
 */
public interface MosaicListener extends ProgressListener {

    default void onPreview(PreviewEvent event) {}

    default void onTileFailed(TileFailure failure) {}

    default void onCompleted(MosaicResult result) {}

    default void onCancelled() {}

    default void onError(MosaicException error) {}

    MosaicListener NONE = new MosaicListener() {};
}
