package gabaritodetector;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class DebugOverlay {

    /**
     * Desenha sobre uma cópia colorida da imagem normalizada: pontos de referência válidos (azul),
     * candidatos reprovados (vermelho) e marcas aceitas (verde).
     * @return Nova Mat BGR; o chamador deve liberá-la.
     */
    public static Mat desenhar(DetectionResult resultado) {
        Mat saida = new Mat();
        Imgproc.cvtColor(resultado.normalizada.cinza, saida, Imgproc.COLOR_GRAY2BGR);

        for (ReferencePoint p : resultado.grade.pontosValidos()) {
            Imgproc.circle(saida, new Point(p.x, p.y), 2, COLOR_BLUE, -1);
        }

        for (CandidateCircle c : resultado.candidatos) {
            if (foiAceito(c, resultado)) continue;
            Imgproc.circle(saida, new Point(c.x, c.y), c.raio, COLOR_RED, 1);
        }
        for (ValidatedCircle v : resultado.validados) {
            Imgproc.circle(saida, new Point(v.x, v.y), v.raio, COLOR_GREEN, 2);
        }
        return saida;
    }

    private static boolean foiAceito(CandidateCircle c, DetectionResult resultado) {
        for (ValidatedCircle v : resultado.validados) {
            if (v.x == c.x && v.y == c.y && v.raio == c.raio) return true;
        }
        return false;
    }
}
