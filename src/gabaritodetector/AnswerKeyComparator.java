package gabaritodetector;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import static gabaritodetector.Constants.*;
import static gabaritodetector.DataModels.*;

public class AnswerKeyComparator {

    private static final DateTimeFormatter FORMATO_DATA = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss");
    private static final String LINHA = "=".repeat(60);

    /**
     * Compara as marcações lidas com o gabarito oficial. Somente as questões do gabarito contam;
     * questões anuladas não são comparadas.
     */
    public static ComparisonResult comparar(AnswerMap marcacoes, Map<Integer, String> gabaritoOficial) {
        int acertos = 0, erros = 0, naoRespondidas = 0, anuladas = 0;

        for (Map.Entry<Integer, String> entry : gabaritoOficial.entrySet()) {
            String respostaCandidato = marcacoes.get(entry.getKey());
            switch (status(entry.getValue(), respostaCandidato)) {
                case "ANULADA": anuladas++; break;
                case "NÃO RESP": naoRespondidas++; break;
                case "ACERTO": acertos++; break;
                default: erros++;
            }
        }
        return new ComparisonResult(acertos, erros, naoRespondidas, anuladas);
    }

    static String status(String respostaOficial, String respostaCandidato) {
        if (ANULADA.equalsIgnoreCase(respostaOficial)) return "ANULADA";
        if (respostaCandidato == null) return "NÃO RESP";
        if (respostaCandidato.equalsIgnoreCase(respostaOficial)) return "ACERTO";
        return "ERRO";
    }

    public static String gerarRelatorio(String nomeCandidato, AnswerMap marcacoes, Map<Integer, String> gabaritoOficial) {
        return gerarRelatorio(nomeCandidato, marcacoes, gabaritoOficial, LocalDateTime.now());
    }

    /** Relatório em texto com o resumo e a comparação questão por questão. */
    public static String gerarRelatorio(String nomeCandidato, AnswerMap marcacoes,
                                        Map<Integer, String> gabaritoOficial, LocalDateTime dataHora) {
        ComparisonResult resultado = comparar(marcacoes, gabaritoOficial);
        int total = gabaritoOficial.size();

        StringBuilder sb = new StringBuilder();
        sb.append("RELATÓRIO DE LEITURA DO GABARITO\n").append(LINHA).append("\n\n");
        sb.append("Candidato: ").append(nomeCandidato).append("\n");
        sb.append("Data/Hora: ").append(FORMATO_DATA.format(dataHora)).append("\n\n");

        sb.append("RESUMO\n").append("=".repeat(30)).append("\n");
        sb.append(String.format(Locale.ROOT, "Total de questões: %d%n", total));
        sb.append(String.format(Locale.ROOT, "Acertos: %d (%.1f%%)%n", resultado.acertos, percentual(resultado.acertos, total)));
        sb.append(String.format(Locale.ROOT, "Erros: %d (%.1f%%)%n", resultado.erros, percentual(resultado.erros, total)));
        sb.append(String.format(Locale.ROOT, "Não respondidas: %d (%.1f%%)%n", resultado.naoRespondidas, percentual(resultado.naoRespondidas, total)));
        sb.append(String.format(Locale.ROOT, "Anuladas: %d (%.1f%%)%n%n", resultado.anuladas, percentual(resultado.anuladas, total)));

        sb.append("Questão | Oficial | Candidato | Status\n");
        sb.append("--------|---------|-----------|---------\n");
        for (Map.Entry<Integer, String> entry : new TreeMap<>(gabaritoOficial).entrySet()) {
            String respostaCandidato = marcacoes.get(entry.getKey());
            sb.append(String.format(Locale.ROOT, "   %02d   | %-7s | %-9s | %s%n",
                    entry.getKey(), entry.getValue(),
                    respostaCandidato != null ? respostaCandidato : "N/R",
                    status(entry.getValue(), respostaCandidato)));
        }
        sb.append(LINHA).append("\n");
        return sb.toString();
    }

    private static double percentual(int parte, int total) {
        return total == 0 ? 0.0 : parte * 100.0 / total;
    }
}
