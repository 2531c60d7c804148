package io.docgraph.processing.service.nlp;

import io.docgraph.processing.config.NlpConfig;
import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.EntityType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups mentions that refer to the same thing. Groups are tracked with a union-find over
 * mention indices, so alias chains can never form cycles.
 * <p>
 * Mentions always merge when their case-folded, punctuation-stripped forms are equal.
 * Explicit aliases, initials-only acronyms and partial person/organization names merge only
 * between groups of the same type, and the last two only when enabled.
 */
public class EntityMerger {

    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NlpConfig.Entities settings;
    private final Map<String, String> normalizedAliases;

    public EntityMerger(NlpConfig.Entities settings) {
        this.settings = settings;
        this.normalizedAliases = new HashMap<>();
        settings.aliases().forEach((alias, fullName) ->
                normalizedAliases.put(normalize(alias), normalize(fullName)));
    }

    /**
     * @return groups of mention indices, each group in mention order, groups ordered by their first mention
     */
    public List<List<Integer>> group(List<EntityMention> mentions) {
        UnionFind unionFind = new UnionFind(mentions.size());

        Map<String, Integer> firstByForm = new LinkedHashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            String form = normalize(mentions.get(i).text());
            Integer first = firstByForm.putIfAbsent(form, i);
            if (first != null) {
                unionFind.union(first, i);
            }
        }

        List<FormGroup> forms = new ArrayList<>();
        firstByForm.forEach((form, index) -> forms.add(new FormGroup(form, index, mentions.get(index).text())));
        Map<Integer, EntityType> typeByRoot = dominantTypes(mentions, unionFind);

        for (int a = 0; a < forms.size(); a++) {
            for (int b = 0; b < forms.size(); b++) {
                if (a == b) {
                    continue;
                }
                FormGroup left = forms.get(a);
                FormGroup right = forms.get(b);
                EntityType leftType = typeByRoot.get(unionFind.find(left.firstIndex()));
                EntityType rightType = typeByRoot.get(unionFind.find(right.firstIndex()));
                if (leftType != rightType) {
                    continue;
                }
                if (isAlias(left, right) || (settings.acronymMatching() && isAcronymOf(left.surface(), right.surface()))) {
                    unionFind.union(left.firstIndex(), right.firstIndex());
                }
            }
        }

        if (settings.partialNameMatching()) {
            mergePartialNames(forms, unionFind, typeByRoot);
        }

        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            groups.computeIfAbsent(unionFind.find(i), root -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(groups.values());
    }

    public static String normalize(String surface) {
        String stripped = PUNCTUATION.matcher(surface.toLowerCase(Locale.ROOT)).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        return collapsed.isEmpty() ? surface.toLowerCase(Locale.ROOT).trim() : collapsed;
    }

    /**
     * True when {@code acronym} is the initials of {@code phrase}, e.g. "WHO" / "World Health Organization".
     * Both the initials of every word and of capitalised words only ("BoA" / "Bank of America") count.
     */
    static boolean isAcronymOf(String acronym, String phrase) {
        String letters = acronym.replace(".", "");
        if (letters.length() < 2 || !letters.chars().allMatch(Character::isLetter)
                || letters.chars().filter(Character::isUpperCase).count() < 2) {
            return false;
        }
        String[] words = WHITESPACE.split(PUNCTUATION.matcher(phrase).replaceAll(" ").trim());
        if (words.length < 2) {
            return false;
        }

        StringBuilder allInitials = new StringBuilder();
        StringBuilder capitalInitials = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty() || !Character.isLetter(word.charAt(0))) {
                continue;
            }
            allInitials.append(word.charAt(0));
            if (Character.isUpperCase(word.charAt(0))) {
                capitalInitials.append(word.charAt(0));
            }
        }
        return letters.equalsIgnoreCase(allInitials.toString())
                || letters.equalsIgnoreCase(capitalInitials.toString());
    }

    private boolean isAlias(FormGroup left, FormGroup right) {
        return right.form().equals(normalizedAliases.get(left.form()));
    }

    /**
     * "Smith" joins "John Smith" only when it matches a single longer form, so an ambiguous
     * short name never bridges two different people.
     */
    private void mergePartialNames(List<FormGroup> forms, UnionFind unionFind, Map<Integer, EntityType> typeByRoot) {
        for (FormGroup shorter : forms) {
            EntityType type = typeByRoot.get(unionFind.find(shorter.firstIndex()));
            if (type != EntityType.PERSON && type != EntityType.ORGANIZATION) {
                continue;
            }
            List<String> shortTokens = Arrays.asList(shorter.form().split(" "));

            List<FormGroup> matches = new ArrayList<>();
            for (FormGroup longer : forms) {
                if (longer == shorter || typeByRoot.get(unionFind.find(longer.firstIndex())) != type) {
                    continue;
                }
                List<String> longTokens = Arrays.asList(longer.form().split(" "));
                if (longTokens.size() > shortTokens.size()
                        && (longTokens.subList(0, shortTokens.size()).equals(shortTokens)
                        || longTokens.subList(longTokens.size() - shortTokens.size(), longTokens.size()).equals(shortTokens))) {
                    matches.add(longer);
                }
            }

            long distinctTargets = matches.stream().map(match -> unionFind.find(match.firstIndex())).distinct().count();
            if (distinctTargets == 1) {
                unionFind.union(shorter.firstIndex(), matches.get(0).firstIndex());
            }
        }
    }

    private Map<Integer, EntityType> dominantTypes(List<EntityMention> mentions, UnionFind unionFind) {
        Map<Integer, Map<EntityType, Integer>> counts = new HashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            counts.computeIfAbsent(unionFind.find(i), root -> new EnumMap<>(EntityType.class))
                    .merge(mentions.get(i).type(), 1, Integer::sum);
        }
        Map<Integer, EntityType> types = new HashMap<>();
        counts.forEach((root, byType) -> types.put(root, dominantType(byType)));
        return types;
    }

    static EntityType dominantType(Map<EntityType, Integer> byType) {
        return byType.entrySet().stream()
                .filter(entry -> entry.getKey() != EntityType.UNKNOWN)
                // ties go to the type declared first in EntityType
                .max(Map.Entry.<EntityType, Integer>comparingByValue()
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(EntityType.UNKNOWN);
    }

    private record FormGroup(String form, int firstIndex, String surface) {}

    private static final class UnionFind {
        private final int[] parent;
        private final int[] rank;

        UnionFind(int size) {
            parent = new int[size];
            rank = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return;
            }
            // Lower index stays root so group identity follows first occurrence
            if (rank[rootA] < rank[rootB] || (rank[rootA] == rank[rootB] && rootB < rootA)) {
                int swap = rootA;
                rootA = rootB;
                rootB = swap;
            }
            parent[rootB] = rootA;
            if (rank[rootA] == rank[rootB]) {
                rank[rootA]++;
            }
        }
    }
}
