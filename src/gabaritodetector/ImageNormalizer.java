package gabaritodetector;

import org.opencv.core.*;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class ImageNormalizer {

    static {
        carregarOpenCv();
    }

    private final LayoutConfig layout;

    public ImageNormalizer(LayoutConfig layout) {
        this.layout = layout;
    }

    /**
     * Decodifica os bytes de uma imagem (qualquer formato suportado pelo OpenCV) e normaliza.
     * @throws ImageDecodeException se os bytes não formarem uma imagem.
     */
    public NormalizedImage normalizar(byte[] bytesImagem) throws ImageDecodeException {
        if (bytesImagem == null || bytesImagem.length == 0) {
            throw new ImageDecodeException("Conteúdo da imagem vazio");
        }
        MatOfByte buffer = new MatOfByte(bytesImagem);
        Mat imagem = null;
        try {
            imagem = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
        } catch (CvException e) {
            throw new ImageDecodeException("Falha ao decodificar a imagem: " + e.getMessage(), e);
        } finally {
            buffer.release();
        }
        try {
            return normalizar(imagem);
        } finally {
            if (imagem != null) imagem.release();
        }
    }

    public NormalizedImage normalizar(BufferedImage imagem) throws ImageDecodeException {
        if (imagem == null) {
            throw new ImageDecodeException("Imagem nula");
        }
        Mat mat = bufferedImageToMat(imagem);
        try {
            return normalizar(mat);
        } finally {
            mat.release();
        }
    }

    /**
     * Redimensiona para a resolução de referência (Lanczos, sem recorte), converte para cinza,
     * suaviza (Gaussiano 5x5) e equaliza o contraste localmente (CLAHE 8x8).
     * A Mat de entrada não é alterada.
     */
    public NormalizedImage normalizar(Mat imagem) throws ImageDecodeException {
        if (imagem == null || imagem.empty()) {
            throw new ImageDecodeException("Não foi possível carregar a imagem");
        }

        Mat redimensionada = null;
        Mat cinza = null;
        Mat suavizada = null;
        try {
            Size tamanhoEsperado = new Size(layout.larguraEsperada, layout.alturaEsperada);
            if (imagem.cols() != layout.larguraEsperada || imagem.rows() != layout.alturaEsperada) {
                redimensionada = new Mat();
                Imgproc.resize(imagem, redimensionada, tamanhoEsperado, 0, 0, Imgproc.INTER_LANCZOS4);
            } else {
                redimensionada = imagem.clone();
            }

            cinza = new Mat();
            switch (redimensionada.channels()) {
                case 1:
                    redimensionada.copyTo(cinza);
                    break;
                case 4:
                    Imgproc.cvtColor(redimensionada, cinza, Imgproc.COLOR_BGRA2GRAY);
                    break;
                default:
                    Imgproc.cvtColor(redimensionada, cinza, Imgproc.COLOR_BGR2GRAY);
            }

            // Filtro Gaussiano para reduzir o ruído do scanner
            suavizada = new Mat();
            Imgproc.GaussianBlur(cinza, suavizada, new Size(BLUR_KERNEL, BLUR_KERNEL), BLUR_SIGMA);

            // Equalização adaptativa para compensar iluminação desigual
            Mat realcada = new Mat();
            CLAHE clahe = Imgproc.createCLAHE(CLAHE_CLIP_LIMIT, new Size(CLAHE_TILE_GRID, CLAHE_TILE_GRID));
            clahe.apply(suavizada, realcada);

            return new NormalizedImage(realcada);
        } finally {
            if (redimensionada != null) redimensionada.release();
            if (cinza != null) cinza.release();
            if (suavizada != null) suavizada.release();
        }
    }

    // Conversão BufferedImage → Mat (BGR de 8 bits)
    static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage convertida = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = convertida.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        byte[] dados = ((DataBufferByte) convertida.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, dados);
        return mat;
    }
}
