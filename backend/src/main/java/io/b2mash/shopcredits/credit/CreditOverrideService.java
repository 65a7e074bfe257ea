package io.b2mash.shopcredits.credit;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Stores operator overrides and substitutes them into generated credit rows. */
@Service
public class CreditOverrideService {

  private static final Logger log = LoggerFactory.getLogger(CreditOverrideService.class);

  private final CreditOverrideRepository creditOverrideRepository;

  public CreditOverrideService(CreditOverrideRepository creditOverrideRepository) {
    this.creditOverrideRepository = creditOverrideRepository;
  }

  /** Returns the rows with any matching override's non-null fields substituted. */
  @Transactional(readOnly = true)
  public List<CreditRow> applyOverrides(String roNumber, List<CreditRow> rows) {
    var overrides =
        creditOverrideRepository.findByRoNumber(roNumber).stream()
            .collect(
                Collectors.toMap(CreditOverride::key, Function.identity(), (first, dup) -> first));
    if (overrides.isEmpty()) {
      return rows;
    }
    return rows.stream()
        .map(
            row -> {
              var override = overrides.get(row.key());
              return override != null ? row.withOverride(override) : row;
            })
        .toList();
  }

  @Transactional(readOnly = true)
  public Optional<CreditOverride> findByKey(CreditRowKey key) {
    return creditOverrideRepository.findByKey(
        key.roNumber(), key.fromStage(), key.toStage(), key.note());
  }

  /** Insert-or-replace on the row key. */
  @Transactional
  public CreditOverride upsert(CreditRowKey key, LocalDate date, String tech, BigDecimal hours) {
    String normalizedTech = tech == null || tech.isBlank() ? null : tech.strip();
    var existing = findByKey(key);
    CreditOverride saved;
    if (existing.isPresent()) {
      existing.get().replace(date, normalizedTech, hours);
      saved = creditOverrideRepository.save(existing.get());
    } else {
      saved = creditOverrideRepository.save(new CreditOverride(key, date, normalizedTech, hours));
    }
    log.info(
        "Set credit override on RO {} [{} -> {}] '{}': date={}, tech={}, hours={}",
        key.roNumber(),
        key.fromStage(),
        key.toStage(),
        key.note(),
        date,
        normalizedTech,
        hours);
    return saved;
  }

  /** Deletes the override for the key. Returns false when none existed. */
  @Transactional
  public boolean delete(CreditRowKey key) {
    var existing = findByKey(key);
    if (existing.isEmpty()) {
      return false;
    }
    creditOverrideRepository.delete(existing.get());
    log.info(
        "Deleted credit override on RO {} [{} -> {}] '{}'",
        key.roNumber(),
        key.fromStage(),
        key.toStage(),
        key.note());
    return true;
  }
}
