package com.seveninterprise.backupforge.services;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Avalia padrões glob de exclusão contra caminhos relativos ao diretório incluído
 *
 * Um padrão exclui o caminho quando casa com o nome do arquivo, com qualquer
 * segmento de diretório ou com o caminho relativo inteiro. Assim {@code *.tmp}
 * exclui arquivos temporários em qualquer profundidade e {@code node_modules}
 * exclui a subárvore inteira.
 */
public class ExclusionMatcher {

    private final List<PathMatcher> matchers = new ArrayList<>();

    public ExclusionMatcher(List<String> patterns) {
        if (patterns != null) {
            for (String pattern : patterns) {
                if (pattern != null && !pattern.isBlank()) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.trim()));
                }
            }
        }
    }

    public boolean matches(Path relativePath) {
        if (matchers.isEmpty() || relativePath == null || relativePath.getNameCount() == 0) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(relativePath)) {
                return true;
            }
            for (Path segment : relativePath) {
                if (matcher.matches(segment)) {
                    return true;
                }
            }
        }
        return false;
    }
}
