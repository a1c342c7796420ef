package com.delta.factengine.facts.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.List;

public record CliOptions(
    boolean force,
    Long companyId,
    Integer offset,
    Integer limit,
    boolean inspect,
    boolean refreshRates,
    String importPath
) {
    public static CliOptions parse(ApplicationArguments args) {
        Long companyId = parseLong(args, "id");
        Integer offset = parseInt(args, "offset");
        Integer limit = parseInt(args, "limit");
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("--offset must not be negative");
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("--limit must be positive");
        }
        String importPath = single(args, "import");
        if (args.containsOption("import") && (importPath == null || importPath.isBlank())) {
            throw new IllegalArgumentException("--import requires a CSV path");
        }
        return new CliOptions(
            flag(args, "force"),
            companyId,
            offset,
            limit,
            flag(args, "inspect"),
            flag(args, "refresh-rates"),
            importPath
        );
    }

    public boolean hasImport() {
        return importPath != null && !importPath.isBlank();
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = single(args, name);
        return value == null || value.isBlank() || Boolean.parseBoolean(value);
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static Integer parseInt(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Long parseLong(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got '" + value + "'", e);
        }
    }
}
