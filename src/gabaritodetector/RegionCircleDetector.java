package gabaritodetector;

import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import java.util.ArrayList;
import java.util.List;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class RegionCircleDetector {

    static {
        carregarOpenCv();
    }

    private final LayoutConfig layout;
    private final DetectorParams parametros;

    public RegionCircleDetector(LayoutConfig layout, DetectorParams parametros) {
        this.layout = layout;
        this.parametros = parametros;
    }

    /**
     * Executa a transformada de Hough em cada coluna, de forma independente.
     * Os candidatos são devolvidos na ordem das colunas e, dentro de cada coluna, na ordem
     * em que o HoughCircles os emite. Colunas fora dos limites da imagem são ignoradas.
     * @param imagem A imagem normalizada.
     * @return Candidatos em coordenadas absolutas da imagem.
     */
    public List<CandidateCircle> detectar(NormalizedImage imagem) {
        List<CandidateCircle> candidatos = new ArrayList<>();

        for (int c = 0; c < layout.colunas.size(); c++) {
            ColumnRegion regiao = layout.colunas.get(c);
            if (!regiao.cabeEm(imagem.largura(), imagem.altura())) {
                System.err.printf("  ⚠ Aviso: coluna %d %s fora dos limites da imagem (%dx%d). Coluna ignorada.%n",
                        c + 1, regiao, imagem.largura(), imagem.altura());
                continue;
            }
            candidatos.addAll(detectarNaRegiao(imagem.cinza, regiao, c));
        }
        return candidatos;
    }

    List<CandidateCircle> detectarNaRegiao(Mat cinza, ColumnRegion regiao, int coluna) {
        List<CandidateCircle> encontrados = new ArrayList<>();
        Mat roi = null;
        Mat circulos = null;
        try {
            roi = new Mat(cinza, new Rect(regiao.x, regiao.y, regiao.w, regiao.h));
            circulos = new Mat();
            Imgproc.HoughCircles(roi, circulos, Imgproc.HOUGH_GRADIENT,
                    1.0,                          // dp
                    parametros.distanciaMinima,
                    parametros.param1,            // limiar superior do Canny
                    parametros.param2,            // limiar do acumulador
                    parametros.raioMinimo,
                    parametros.raioMaximo);

            for (int i = 0; i < circulos.cols(); i++) {
                double[] dados = circulos.get(0, i);
                if (dados == null) continue;

                // Converte para coordenadas da imagem completa
                int x = regiao.x + (int) Math.round(dados[0]);
                int y = regiao.y + (int) Math.round(dados[1]);
                int raio = (int) Math.round(dados[2]);
                encontrados.add(new CandidateCircle(x, y, raio, coluna));
            }
        } finally {
            if (roi != null) roi.release();
            if (circulos != null) circulos.release();
        }
        return encontrados;
    }
}
