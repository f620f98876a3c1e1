package gabaritodetector;

import org.opencv.core.Mat;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

/**
 * Detector de marcações do gabarito: normaliza a imagem, detecta círculos por coluna,
 * valida a escuridão de cada candidato e mapeia os aprovados para questão/alternativa.
 * <p>
 * Cada chamada é síncrona e dona de seus buffers. O template e as grades de referência
 * (uma por total de questões) são somente leitura, então a mesma instância pode ser usada
 * por várias threads.
 */
public class GabaritoDetector {

    static {
        carregarOpenCv();
    }

    private final FolhaTemplate template;
    private final ImageNormalizer normalizador;
    private final RegionCircleDetector detector;
    private final CircleValidator validador;
    private final Map<Integer, ReferenceGrid> gradesPorTotal = new ConcurrentHashMap<>();

    public GabaritoDetector() {
        this(new FolhaTemplate(LayoutConfig.padrao(), DetectorParams.padrao()));
    }

    public GabaritoDetector(FolhaTemplate template) {
        this.template = template;
        this.normalizador = new ImageNormalizer(template.layout);
        this.detector = new RegionCircleDetector(template.layout, template.parametros);
        this.validador = new CircleValidator(template.parametros);
    }

    public AnswerMap detectar(byte[] bytesImagem, int totalQuestoes) throws ImageDecodeException {
        ReferenceGrid grade = gradePara(totalQuestoes);
        return executar(normalizador.normalizar(bytesImagem), grade);
    }

    public AnswerMap detectar(Mat imagem, int totalQuestoes) throws ImageDecodeException {
        ReferenceGrid grade = gradePara(totalQuestoes);
        return executar(normalizador.normalizar(imagem), grade);
    }

    public AnswerMap detectar(BufferedImage imagem, int totalQuestoes) throws ImageDecodeException {
        ReferenceGrid grade = gradePara(totalQuestoes);
        return executar(normalizador.normalizar(imagem), grade);
    }

    public AnswerMap detectar(Path caminhoImagem, int totalQuestoes) throws ImageDecodeException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(caminhoImagem);
        } catch (IOException e) {
            throw new ImageDecodeException("Não foi possível ler o arquivo " + caminhoImagem + ": " + e.getMessage(), e);
        }
        return detectar(bytes, totalQuestoes);
    }

    /**
     * Executa o pipeline e devolve todos os resultados intermediários.
     * O chamador é dono do resultado e deve chamar {@link DetectionResult#release()}.
     */
    public DetectionResult analisar(Mat imagem, int totalQuestoes) throws ImageDecodeException {
        ReferenceGrid grade = gradePara(totalQuestoes);
        NormalizedImage normalizada = normalizador.normalizar(imagem);
        List<CandidateCircle> candidatos = detector.detectar(normalizada);
        List<ValidatedCircle> validados = validador.validar(normalizada, candidatos);
        AnswerMap respostas = new DistanceVectorMapper(grade, template.parametros.toleranciaPx).mapear(validados);
        return new DetectionResult(normalizada, grade, candidatos, validados, respostas);
    }

    public ReferenceGrid gradePara(int totalQuestoes) {
        return gradesPorTotal.computeIfAbsent(totalQuestoes, n -> ReferenceGridBuilder.build(template.layout, n));
    }

    public FolhaTemplate getTemplate() {
        return template;
    }

    private AnswerMap executar(NormalizedImage normalizada, ReferenceGrid grade) {
        try {
            List<CandidateCircle> candidatos = detector.detectar(normalizada);
            List<ValidatedCircle> validados = validador.validar(normalizada, candidatos);
            return new DistanceVectorMapper(grade, template.parametros.toleranciaPx).mapear(validados);
        } finally {
            normalizada.release();
        }
    }
}
