package work.pollochang.mosaic.core;

/**
 * 引擎內部非預期錯誤，會中止整個流程並回報給呼叫端。
 */
public class EngineFaultException extends MosaicException {

    public EngineFaultException(String message) {
        super(message);
    }

    public EngineFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
