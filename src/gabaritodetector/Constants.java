package gabaritodetector;

import nu.pattern.OpenCV;
import org.opencv.core.Scalar;
import java.io.File;

public class Constants {

    // Se definida, a biblioteca nativa indicada é carregada no lugar da empacotada pelo openpnp
    public static final String OPENCV_DLL_PATH = System.getProperty("opencv.dll.path");
    public static final String S = File.separator;

    // --- Caminhos de Arquivo ---
    public static final String PATH_LAYOUT = System.getProperty("gabarito.layout");
    public static final String PATH_GABARITO_OFICIAL = System.getProperty("gabarito.oficial");
    public static final String PATH_OUTPUT_DIR = System.getProperty("gabarito.saida", "saidas" + S);
    public static final String RESOURCE_LAYOUT_PADRAO = "/gabaritodetector/layout_conab.txt";
    public static final String OUTPUT_RESPOSTAS_PREFIX = "respostas_";
    public static final String OUTPUT_DEBUG_PREFIX = "deteccao_";

    // --- Layout da folha CONAB (2338x1653) ---
    public static final int NUM_COLUNAS = 5;
    public static final String[] ALTERNATIVAS = {"A", "B", "C", "D", "E"};
    public static final int LARGURA_ESPERADA = 2338;
    public static final int ALTURA_ESPERADA = 1653;
    public static final int[][] REGIOES_COLUNAS = {
            {842, 580, 218, 860},
            {1125, 580, 215, 860},
            {1400, 580, 220, 860},
            {1683, 580, 217, 860},
            {1960, 580, 210, 860}
    };
    public static final int ESPACAMENTO_QUESTOES = 44;
    public static final int ESPACAMENTO_ALTERNATIVAS = 43;
    public static final int OFFSET_PRIMEIRA_QUESTAO = 10;
    public static final int MAX_QUESTOES_POR_COLUNA = 25;

    // --- Parâmetros de Normalização ---
    public static final int BLUR_KERNEL = 5;
    public static final double BLUR_SIGMA = 1.0;
    public static final double CLAHE_CLIP_LIMIT = 2.0;
    public static final int CLAHE_TILE_GRID = 8;

    // --- Parâmetros de Detecção de Bolha (Hough) ---
    public static final int RAIO_MINIMO = 8;
    public static final int RAIO_MAXIMO = 14;
    public static final double HOUGH_PARAM1 = 50.0;
    public static final double HOUGH_PARAM2 = 20.0;
    public static final double DISTANCIA_MINIMA = 20.0;
    public static final double LIMIAR_ESCURIDAO = 120.0;
    public static final double LIMIAR_CIRCULARIDADE = 0.6;
    public static final boolean VERIFICAR_CIRCULARIDADE = false;

    // --- Mapeamento por vetor de distância ---
    public static final double TOLERANCIA_PX = 30.0;

    // --- Gabarito oficial ---
    public static final String ANULADA = "ANULADA";

    // --- Cores (para debug) ---
    public static final Scalar COLOR_GREEN = new Scalar(0, 255, 0);
    public static final Scalar COLOR_RED = new Scalar(0, 0, 255);
    public static final Scalar COLOR_BLUE = new Scalar(255, 0, 0);

    private static boolean opencvCarregado = false;

    public static synchronized void carregarOpenCv() {
        if (opencvCarregado) return;
        if (OPENCV_DLL_PATH != null && !OPENCV_DLL_PATH.isBlank()) {
            System.load(OPENCV_DLL_PATH);
        } else {
            OpenCV.loadLocally();
        }
        opencvCarregado = true;
    }
}
