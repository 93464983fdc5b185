package cfg.cli;

import cfg.eval.EvaluationResult;
import cfg.grammar.Grammar;
import cfg.model.Production;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String cnf(Grammar grammar, List<Production> rules) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(grammar));
    root.put("rule_count", rules.size());
    root.put("rules", ruleStrings(rules));
    return gson.toJson(root);
  }

  String evaluation(Grammar grammar, Map<String, EvaluationResult> results) {
    Map<String, Object> root = new LinkedHashMap<>();
    Map<String, Object> meta = meta(grammar);
    meta.put("max_depth", grammar.maxDepth());
    root.put("meta", meta);

    List<Map<String, Object>> summaries = new ArrayList<>();
    for (Map.Entry<String, EvaluationResult> entry : results.entrySet()) {
      EvaluationResult result = entry.getValue();
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("input", entry.getKey());
      map.put("accepted", result.accepted());
      if (result.accepted()) {
        map.put("path", ruleStrings(result.path().productions()));
        map.put("replay", result.path().replay());
      }
      summaries.add(map);
    }
    root.put("results", summaries);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(Grammar grammar) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("start", grammar.start().name());
    meta.put("variables", grammar.variables().stream().map(v -> v.name()).toList());
    meta.put("alphabet", grammar.alphabet().stream().map(t -> t.name()).toList());
    meta.put("rules", ruleStrings(grammar.rules()));
    return meta;
  }

  private static List<String> ruleStrings(List<Production> rules) {
    return rules.stream().map(Production::toString).toList();
  }
}
