package gabaritodetector;

/**
 * A entrada não pôde ser interpretada como imagem. Erro fatal para a leitura da folha.
 */
public class ImageDecodeException extends Exception {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
