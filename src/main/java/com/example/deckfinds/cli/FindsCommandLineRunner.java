package com.example.deckfinds.cli;

import com.example.deckfinds.config.FindsProperties;
import com.example.deckfinds.model.Cards;
import com.example.deckfinds.model.InvalidDeckException;
import com.example.deckfinds.service.DeckComparison;
import com.example.deckfinds.service.FindsEngine;
import com.example.deckfinds.service.ReportedFind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Classifies a deck given on the command line and prints the result as JSON, e.g.
 * {@code java -jar deckfinds.jar "A♠,2♠,3♠,..."} or {@code --factory} for the factory order.
 */
@Component
@ConditionalOnProperty(prefix = "finds.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FindsCommandLineRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(FindsCommandLineRunner.class);

  static final String FACTORY_FLAG = "--factory";

  private final FindsEngine engine;
  private final ObjectMapper objectMapper;
  private final FindsProperties properties;
  private final PrintStream out;

  @Autowired
  public FindsCommandLineRunner(FindsEngine engine, ObjectMapper objectMapper, FindsProperties properties) {
    this(engine, objectMapper, properties, new PrintStream(System.out, true, StandardCharsets.UTF_8));
  }

  FindsCommandLineRunner(FindsEngine engine, ObjectMapper objectMapper, FindsProperties properties, PrintStream out) {
    this.engine = engine;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.out = out;
  }

  @Override
  public void run(String... args) throws Exception {
    List<String> deck = deckFromArgs(args);
    if (deck.isEmpty()) {
      log.info("No deck given. Pass 52 cards separated by commas or spaces, or {}.", FACTORY_FLAG);
      return;
    }

    List<ReportedFind> finds;
    try {
      finds = engine.detect(deck);
    } catch (InvalidDeckException e) {
      log.warn("Rejected deck ({}): {}", e.getReason(), e.getMessage());
      return;
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("cards", deck);
    result.put("factoryCount", DeckComparison.factoryPositions(deck));
    List<Map<String, Object>> views = new ArrayList<>();
    for (ReportedFind f : finds) views.add(f.toView());
    result.put("finds", views);

    boolean pretty = properties != null && properties.cli().prettyPrint();
    String json = pretty
        ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result)
        : objectMapper.writeValueAsString(result);
    out.println(json);
    log.info("Reported {} finds", finds.size());
  }

  /** Tokens from all non-option arguments; Spring's own {@code --key=value} options are skipped. */
  static List<String> deckFromArgs(String... args) {
    if (args == null) return List.of();
    List<String> tokens = new ArrayList<>();
    for (String arg : args) {
      if (arg == null) continue;
      if (FACTORY_FLAG.equals(arg.trim())) return Cards.FACTORY_ORDER;
      if (arg.startsWith("--")) continue;
      for (String t : arg.split("[,\\s]+")) {
        if (!t.isBlank()) tokens.add(t.trim());
      }
    }
    return tokens;
  }
}
