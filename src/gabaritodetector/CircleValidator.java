package gabaritodetector;

import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import java.util.ArrayList;
import java.util.List;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class CircleValidator {

    static {
        carregarOpenCv();
    }

    private final DetectorParams parametros;

    public CircleValidator(DetectorParams parametros) {
        this.parametros = parametros;
    }

    /**
     * Valida se o círculo detectado é realmente uma bolha preenchida: a intensidade média
     * dentro do disco precisa ficar abaixo do limiar de escuridão. Com a verificação de
     * circularidade ligada, a mancha escura também precisa ter forma regular.
     */
    public boolean isMarcada(NormalizedImage imagem, CandidateCircle candidato) {
        return aprovado(imagem, candidato, intensidadeMedia(imagem.cinza, candidato.x, candidato.y, candidato.raio));
    }

    /** Filtra a lista de candidatos, preservando a ordem de emissão do detector. */
    public List<ValidatedCircle> validar(NormalizedImage imagem, List<CandidateCircle> candidatos) {
        List<ValidatedCircle> validados = new ArrayList<>();
        for (CandidateCircle candidato : candidatos) {
            double media = intensidadeMedia(imagem.cinza, candidato.x, candidato.y, candidato.raio);
            if (aprovado(imagem, candidato, media)) {
                validados.add(new ValidatedCircle(candidato, media));
            }
        }
        return validados;
    }

    private boolean aprovado(NormalizedImage imagem, CandidateCircle candidato, double media) {
        if (media >= parametros.limiarEscuridao) return false;
        if (!parametros.verificarCircularidade) return true;
        return circularidade(imagem.cinza, candidato.x, candidato.y, candidato.raio) >= parametros.limiarCircularidade;
    }

    /**
     * Intensidade média (0-255) dos pixels dentro do disco de raio {@code raio} centrado em (x, y).
     * Retorna 255 se o disco estiver inteiramente fora da imagem.
     */
    public static double intensidadeMedia(Mat cinza, int x, int y, int raio) {
        Rect janela = janela(cinza, x, y, raio);
        if (janela == null) return 255.0;

        Mat sub = null;
        Mat mascara = null;
        try {
            sub = new Mat(cinza, janela);
            mascara = Mat.zeros(janela.height, janela.width, CvType.CV_8UC1);
            Imgproc.circle(mascara, new Point(x - janela.x, y - janela.y), raio, new Scalar(255), -1);
            if (Core.countNonZero(mascara) == 0) return 255.0;
            return Core.mean(sub, mascara).val[0];
        } finally {
            if (sub != null) sub.release();
            if (mascara != null) mascara.release();
        }
    }

    /**
     * Circularidade (4πA/P²) do maior contorno escuro ao redor do candidato.
     * 1.0 para um disco perfeito; valores baixos para traços e rabiscos.
     */
    public double circularidade(Mat cinza, int x, int y, int raio) {
        Rect janela = janela(cinza, x, y, raio * 2);
        if (janela == null) return 0.0;

        Mat sub = null; Mat binaria = null; Mat hierarquia = null;
        List<MatOfPoint> contornos = new ArrayList<>();
        try {
            sub = new Mat(cinza, janela);
            binaria = new Mat();
            hierarquia = new Mat();
            Imgproc.threshold(sub, binaria, parametros.limiarEscuridao, 255, Imgproc.THRESH_BINARY_INV);
            Imgproc.findContours(binaria, contornos, hierarquia, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);

            double melhorArea = 0;
            double melhorPerimetro = 0;
            for (MatOfPoint contorno : contornos) {
                double area = Imgproc.contourArea(contorno);
                if (area > melhorArea) {
                    MatOfPoint2f contorno2f = new MatOfPoint2f(contorno.toArray());
                    melhorArea = area;
                    melhorPerimetro = Imgproc.arcLength(contorno2f, true);
                    contorno2f.release();
                }
            }
            if (melhorPerimetro <= 0) return 0.0;
            return 4 * Math.PI * melhorArea / (melhorPerimetro * melhorPerimetro);
        } finally {
            for (MatOfPoint contorno : contornos) contorno.release();
            if (sub != null) sub.release();
            if (binaria != null) binaria.release();
            if (hierarquia != null) hierarquia.release();
        }
    }

    // Janela quadrada ao redor do centro, recortada aos limites da imagem
    private static Rect janela(Mat cinza, int x, int y, int meiaLargura) {
        int x0 = Math.max(x - meiaLargura, 0);
        int y0 = Math.max(y - meiaLargura, 0);
        int x1 = Math.min(x + meiaLargura + 1, cinza.cols());
        int y1 = Math.min(y + meiaLargura + 1, cinza.rows());
        if (x1 <= x0 || y1 <= y0) return null;
        return new Rect(x0, y0, x1 - x0, y1 - y0);
    }
}
