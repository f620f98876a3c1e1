package gabaritodetector;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Respostas lidas de uma folha: número da questão (1-based) para a letra marcada.
 * Questões sem marca não aparecem. Cada questão é registrada no máximo uma vez.
 */
public class AnswerMap {

    private final TreeMap<Integer, String> respostas = new TreeMap<>();

    /**
     * Registra a resposta se a questão ainda não tiver uma.
     * @return false se a questão já estava preenchida (a nova marca é descartada).
     */
    public boolean registrar(int questao, String alternativa) {
        if (questao <= 0) {
            throw new IllegalArgumentException("Número de questão inválido: " + questao);
        }
        return respostas.putIfAbsent(questao, alternativa) == null;
    }

    public String get(int questao) {
        return respostas.get(questao);
    }

    public boolean contains(int questao) {
        return respostas.containsKey(questao);
    }

    public int size() {
        return respostas.size();
    }

    public boolean isEmpty() {
        return respostas.isEmpty();
    }

    public SortedMap<Integer, String> asMap() {
        return Collections.unmodifiableSortedMap(respostas);
    }

    /** Vetor de respostas 1..totalQuestoes separado por vírgulas; questões sem marca ficam vazias. */
    public String toVetor(int totalQuestoes) {
        StringBuilder sb = new StringBuilder();
        for (int q = 1; q <= totalQuestoes; q++) {
            if (q > 1) sb.append(",");
            sb.append(respostas.getOrDefault(q, ""));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnswerMap)) return false;
        return respostas.equals(((AnswerMap) o).respostas);
    }

    @Override
    public int hashCode() {
        return respostas.hashCode();
    }

    @Override
    public String toString() {
        return respostas.toString();
    }

    public static AnswerMap of(Map<Integer, String> respostas) {
        AnswerMap mapa = new AnswerMap();
        respostas.forEach(mapa::registrar);
        return mapa;
    }
}
