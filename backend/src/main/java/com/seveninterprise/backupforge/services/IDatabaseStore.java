package com.seveninterprise.backupforge.services;

import java.nio.file.Path;
import java.util.Map;

/**
 * Acesso ao banco de dados embarcado protegido pelo backup
 */
public interface IDatabaseStore {

    /**
     * Caminho absoluto do arquivo do banco em uso
     */
    Path getDatabaseFile();

    /**
     * Grava um snapshot transacionalmente consistente do banco em {@code target}
     *
     * @param target Arquivo de destino (não pode existir)
     */
    void snapshotTo(Path target);

    /**
     * Contagem de registros por tabela de usuário do arquivo informado
     *
     * @param databaseFile Arquivo SQLite (normalmente o snapshot)
     * @return Mapa tabela → registros, na ordem das tabelas
     */
    Map<String, Long> countRecords(Path databaseFile);
}
