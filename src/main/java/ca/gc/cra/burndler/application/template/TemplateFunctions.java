package ca.gc.cra.burndler.application.template;

import ca.gc.cra.burndler.application.port.ClockPort;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Function table available to templates.
 * <p><strong>Why:</strong> The table is an injected value rather than global state, so tests can pin the
 * clock, random source, and environment and callers can add their own functions.</p>
 * <p><strong>Role:</strong> Collaborator of {@link TemplateEngine}; the parser rejects names not in the table.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; functions only touch thread-safe
 * collaborators ({@link SecureRandom}, {@link ClockPort}).</p>
 * <p><strong>Security:</strong> {@code env} only exposes {@code HOME}, {@code USER}, {@code HOSTNAME}, and
 * {@code PWD}; every other name renders as the empty string.</p>
 *
 * @since 0.1.0
 */
public final class TemplateFunctions {
  private static final Logger log = LoggerFactory.getLogger(TemplateFunctions.class);

  /** Environment variables templates may read. */
  public static final Set<String> ENV_ALLOW_LIST = Set.of("HOME", "USER", "HOSTNAME", "PWD");

  static final String PASSWORD_CHARSET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%^&*()-_=+[]{}|;:,.<>?";
  static final int MAX_PASSWORD_LENGTH = 128;

  private final Map<String, TemplateFunction> functions;

  private TemplateFunctions(Map<String, TemplateFunction> functions) {
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
  }

  /**
   * Standard table backed by the system clock, a fresh {@link SecureRandom}, and the process environment.
   *
   * @return function table
   */
  public static TemplateFunctions standard() {
    return standard(ClockPort.SYSTEM, new SecureRandom(), System::getenv);
  }

  /**
   * Standard table with explicit collaborators.
   *
   * @param clock source for {@code now} and {@code timestamp}
   * @param random source for {@code generatePassword} and {@code randomPort}
   * @param environment environment lookup consulted by {@code env} for allow-listed names
   * @return function table
   */
  public static TemplateFunctions standard(ClockPort clock, SecureRandom random, UnaryOperator<String> environment) {
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(random, "random");
    Objects.requireNonNull(environment, "environment");
    Map<String, TemplateFunction> table = new LinkedHashMap<>();

    table.put("upper", args -> TemplateValues.toText(single("upper", args)).toUpperCase(Locale.ROOT));
    table.put("lower", args -> TemplateValues.toText(single("lower", args)).toLowerCase(Locale.ROOT));
    table.put("trim", args -> TemplateValues.toText(single("trim", args)).strip());
    table.put("replace", args -> {
      arity("replace", args, 3);
      return text(args, 0).replace(text(args, 1), text(args, 2));
    });
    table.put("contains", args -> {
      arity("contains", args, 2);
      return text(args, 0).contains(text(args, 1));
    });
    table.put("hasPrefix", args -> {
      arity("hasPrefix", args, 2);
      return text(args, 0).startsWith(text(args, 1));
    });
    table.put("hasSuffix", args -> {
      arity("hasSuffix", args, 2);
      return text(args, 0).endsWith(text(args, 1));
    });
    table.put("split", args -> {
      arity("split", args, 2);
      return split(text(args, 0), text(args, 1));
    });
    table.put("join", args -> {
      arity("join", args, 2);
      if (!(args.get(0) instanceof Collection<?> items)) {
        throw new IllegalArgumentException("expected list but got " + TemplateValues.describe(args.get(0)));
      }
      List<String> parts = new ArrayList<>(items.size());
      items.forEach(item -> parts.add(TemplateValues.print(item)));
      return String.join(text(args, 1), parts);
    });

    table.put("add", args -> {
      arity("add", args, 2);
      return Math.addExact(integer(args, 0), integer(args, 1));
    });
    table.put("sub", args -> {
      arity("sub", args, 2);
      return Math.subtractExact(integer(args, 0), integer(args, 1));
    });
    table.put("mul", args -> {
      arity("mul", args, 2);
      return Math.multiplyExact(integer(args, 0), integer(args, 1));
    });
    table.put("div", args -> {
      arity("div", args, 2);
      long divisor = integer(args, 1);
      if (divisor == 0) {
        throw new IllegalArgumentException("division by zero");
      }
      return integer(args, 0) / divisor;
    });
    table.put("mod", args -> {
      arity("mod", args, 2);
      long divisor = integer(args, 1);
      if (divisor == 0) {
        throw new IllegalArgumentException("modulo by zero");
      }
      return integer(args, 0) % divisor;
    });

    table.put("default", args -> {
      arity("default", args, 2);
      Object value = args.get(1);
      return value == null || "".equals(value) ? args.get(0) : value;
    });
    table.put("eq", args -> {
      arity("eq", args, 2);
      return TemplateValues.same(args.get(0), args.get(1));
    });
    table.put("ne", args -> {
      arity("ne", args, 2);
      return !TemplateValues.same(args.get(0), args.get(1));
    });

    table.put("env", args -> {
      String name = TemplateValues.toText(single("env", args));
      if (!ENV_ALLOW_LIST.contains(name)) {
        return "";
      }
      String value = environment.apply(name);
      return value == null ? "" : value;
    });
    table.put("uuid", args -> {
      arity("uuid", args, 0);
      return UUID.randomUUID().toString();
    });
    table.put("timestamp", args -> {
      arity("timestamp", args, 0);
      return clock.nowMillis() / 1000L;
    });
    table.put("now", args -> {
      arity("now", args, 0);
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
          Instant.ofEpochMilli(clock.nowMillis()).truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    });

    table.put("generatePassword", args -> {
      long length = TemplateValues.toLong(single("generatePassword", args));
      if (length < 1) {
        throw new IllegalArgumentException("password length must be at least 1");
      }
      if (length > MAX_PASSWORD_LENGTH) {
        throw new IllegalArgumentException("password length must be at most " + MAX_PASSWORD_LENGTH);
      }
      StringBuilder out = new StringBuilder((int) length);
      for (int i = 0; i < length; i++) {
        out.append(PASSWORD_CHARSET.charAt(random.nextInt(PASSWORD_CHARSET.length())));
      }
      return out.toString();
    });
    table.put("hash", args -> sha256Hex(TemplateValues.toText(single("hash", args))));
    table.put("base64encode", args -> Base64.getEncoder().encodeToString(
        TemplateValues.toText(single("base64encode", args)).getBytes(StandardCharsets.UTF_8)));
    table.put("base64decode", args -> {
      String encoded = TemplateValues.toText(single("base64decode", args));
      try {
        return new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("base64 decode error: " + ex.getMessage(), ex);
      }
    });

    table.put("randomPort", args -> {
      arity("randomPort", args, 2);
      long min = integer(args, 0);
      long max = integer(args, 1);
      if (min < 1 || min > 65535) {
        throw new IllegalArgumentException("min port must be between 1 and 65535");
      }
      if (max < 1 || max > 65535) {
        throw new IllegalArgumentException("max port must be between 1 and 65535");
      }
      if (min > max) {
        throw new IllegalArgumentException("min port must be less than or equal to max port");
      }
      return min + random.nextInt((int) (max - min + 1));
    });
    table.put("localIP", args -> {
      arity("localIP", args, 0);
      return localIp();
    });

    table.put("index", TemplateFunctions::index);
    table.put("len", args -> length(single("len", args)));
    table.put("not", args -> !TemplateValues.truthy(single("not", args)));
    table.put("and", args -> {
      atLeast("and", args, 1);
      for (Object arg : args) {
        if (!TemplateValues.truthy(arg)) {
          return arg;
        }
      }
      return args.get(args.size() - 1);
    });
    table.put("or", args -> {
      atLeast("or", args, 1);
      for (Object arg : args) {
        if (TemplateValues.truthy(arg)) {
          return arg;
        }
      }
      return args.get(args.size() - 1);
    });
    table.put("print", TemplateFunctions::print);

    return new TemplateFunctions(table);
  }

  /**
   * Returns a copy of this table with one function added or replaced.
   *
   * @param name function name as written in templates
   * @param function implementation
   * @return extended table
   */
  public TemplateFunctions with(String name, TemplateFunction function) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(function, "function");
    Map<String, TemplateFunction> copy = new LinkedHashMap<>(functions);
    copy.put(name, function);
    return new TemplateFunctions(copy);
  }

  public Optional<TemplateFunction> find(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public Set<String> names() {
    return functions.keySet();
  }

  private static Object index(List<Object> args) {
    atLeast("index", args, 1);
    Object current = args.get(0);
    for (int i = 1; i < args.size(); i++) {
      Object key = args.get(i);
      if (current == null) {
        throw new IllegalArgumentException("index of untyped nil");
      }
      if (current instanceof Map<?, ?> map) {
        current = map.get(key == null ? null : String.valueOf(key));
      } else if (current instanceof List<?> list) {
        long position = TemplateValues.toLong(key);
        if (position < 0 || position >= list.size()) {
          throw new IllegalArgumentException("index out of range: " + position);
        }
        current = list.get((int) position);
      } else {
        throw new IllegalArgumentException("can't index item of type " + TemplateValues.describe(current));
      }
    }
    return current;
  }

  private static int length(Object value) {
    if (value instanceof CharSequence s) {
      return s.length();
    }
    if (value instanceof Collection<?> c) {
      return c.size();
    }
    if (value instanceof Map<?, ?> m) {
      return m.size();
    }
    throw new IllegalArgumentException("len of type " + TemplateValues.describe(value));
  }

  /** Concatenates operands, adding a space between two neighbours when neither is a string. */
  private static String print(List<Object> args) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < args.size(); i++) {
      Object arg = args.get(i);
      if (i > 0 && !(arg instanceof String) && !(args.get(i - 1) instanceof String)) {
        out.append(' ');
      }
      out.append(TemplateValues.print(arg));
    }
    return out.toString();
  }

  private static List<String> split(String value, String separator) {
    List<String> parts = new ArrayList<>();
    if (separator.isEmpty()) {
      value.codePoints().forEach(cp -> parts.add(new String(Character.toChars(cp))));
      return parts;
    }
    int cursor = 0;
    while (true) {
      int next = value.indexOf(separator, cursor);
      if (next < 0) {
        parts.add(value.substring(cursor));
        return parts;
      }
      parts.add(value.substring(cursor, next));
      cursor = next + separator.length();
    }
  }

  private static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private static String localIp() {
    try {
      Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
      while (interfaces != null && interfaces.hasMoreElements()) {
        NetworkInterface nic = interfaces.nextElement();
        Enumeration<InetAddress> addresses = nic.getInetAddresses();
        while (addresses.hasMoreElements()) {
          InetAddress address = addresses.nextElement();
          if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
            return address.getHostAddress();
          }
        }
      }
    } catch (SocketException ex) {
      log.debug("Unable to enumerate network interfaces; falling back to loopback", ex);
    }
    return "127.0.0.1";
  }

  private static Object single(String name, List<Object> args) {
    arity(name, args, 1);
    return args.get(0);
  }

  private static String text(List<Object> args, int index) {
    return TemplateValues.toText(args.get(index));
  }

  private static long integer(List<Object> args, int index) {
    return TemplateValues.toLong(args.get(index));
  }

  private static void arity(String name, List<Object> args, int expected) {
    if (args.size() != expected) {
      throw new IllegalArgumentException(
          "wrong number of args for " + name + ": want " + expected + " got " + args.size());
    }
  }

  private static void atLeast(String name, List<Object> args, int minimum) {
    if (args.size() < minimum) {
      throw new IllegalArgumentException(
          "wrong number of args for " + name + ": want at least " + minimum + " got " + args.size());
    }
  }
}
