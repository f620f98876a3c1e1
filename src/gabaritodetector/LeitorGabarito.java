package gabaritodetector;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

/**
 * Leitura de uma folha pela linha de comando.
 * <pre>
 * java -Dgabarito.layout=layout.txt -Dgabarito.oficial=gabarito.txt -Dgabarito.saida=saidas/ \
 *      -jar gabarito-detector.jar folha.jpg 60 [nome do candidato]
 * </pre>
 */
public class LeitorGabarito {

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Uso: LeitorGabarito <imagem> <totalQuestoes> [nomeCandidato]");
            System.exit(2);
            return;
        }

        String caminhoImagem = args[0];
        int totalQuestoes;
        try {
            totalQuestoes = Integer.parseInt(args[1].trim());
        } catch (NumberFormatException e) {
            System.err.println("ERRO FATAL: total de questões inválido: " + args[1]);
            System.exit(2);
            return;
        }
        String nomeCandidato = args.length > 2 ? args[2] : new File(caminhoImagem).getName();

        FolhaTemplate template = PATH_LAYOUT != null
                ? ConfigLoader.loadTemplate(PATH_LAYOUT)
                : ConfigLoader.loadDefaultTemplate();
        if (template == null) {
            System.err.println("ERRO FATAL: Nenhum template carregado. Impossível ler a folha.");
            System.exit(1);
            return;
        }

        File outputDirFile = new File(PATH_OUTPUT_DIR);
        if (!outputDirFile.exists()) {
            outputDirFile.mkdirs();
        }

        String nomeArquivo = new File(caminhoImagem).getName();
        String nomeArquivoBase = nomeArquivo.contains(".")
                ? nomeArquivo.substring(0, nomeArquivo.lastIndexOf('.'))
                : nomeArquivo;

        System.out.printf("➡ Processando %s (%d questões)%n", nomeArquivo, totalQuestoes);
        long inicio = System.nanoTime();

        GabaritoDetector detector = new GabaritoDetector(template);
        Mat imagem = Imgcodecs.imread(caminhoImagem, Imgcodecs.IMREAD_COLOR);
        DetectionResult resultado = null;
        Mat overlay = null;
        try {
            resultado = detector.analisar(imagem, totalQuestoes);
            long duracaoMs = (System.nanoTime() - inicio) / 1_000_000;

            AnswerMap respostas = resultado.respostas;
            System.out.printf("  ✓ Candidatos: %d, marcas válidas: %d, questões lidas: %d/%d%n",
                    resultado.candidatos.size(), resultado.validados.size(), respostas.size(), totalQuestoes);
            System.out.printf("  ✓ Respostas lidas: %s%n", respostas.toVetor(totalQuestoes));
            System.out.printf("  ⏱️ Tempo total da folha: %d ms%n", duracaoMs);

            salvarRespostas(respostas, totalQuestoes, PATH_OUTPUT_DIR + OUTPUT_RESPOSTAS_PREFIX + nomeArquivoBase + ".txt");

            overlay = DebugOverlay.desenhar(resultado);
            Imgcodecs.imwrite(PATH_OUTPUT_DIR + OUTPUT_DEBUG_PREFIX + nomeArquivoBase + ".jpg", overlay);

            if (PATH_GABARITO_OFICIAL != null) {
                Map<Integer, String> gabarito = ConfigLoader.loadGabarito(PATH_GABARITO_OFICIAL);
                if (gabarito.isEmpty()) {
                    System.err.println("  ⚠ Gabarito oficial vazio ou ilegível: " + PATH_GABARITO_OFICIAL);
                } else {
                    System.out.println();
                    System.out.println(AnswerKeyComparator.gerarRelatorio(nomeCandidato, respostas, gabarito));
                }
            }
        } catch (ImageDecodeException | IllegalArgumentException e) {
            System.err.println("  ❌ ERRO FATAL: " + e.getMessage());
            System.exit(1);
        } finally {
            if (overlay != null) overlay.release();
            if (resultado != null) resultado.release();
            imagem.release();
        }
    }

    private static void salvarRespostas(AnswerMap respostas, int totalQuestoes, String caminho) {
        try (BufferedWriter bw = new BufferedWriter(new FileWriter(caminho, StandardCharsets.UTF_8, false))) {
            for (int q = 1; q <= totalQuestoes; q++) {
                String alternativa = respostas.get(q);
                bw.write(q + ";" + (alternativa != null ? alternativa : ""));
                bw.newLine();
            }
        } catch (IOException e) {
            System.err.println("Erro ao salvar respostas: " + e.getMessage());
        }
    }
}
