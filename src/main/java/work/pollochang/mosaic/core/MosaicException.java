package work.pollochang.mosaic.core;

/**
 * 馬賽克引擎所有例外的共同父類別。
 */
public class MosaicException extends RuntimeException {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
