package com.seveninterprise.backupforge.services;

import com.seveninterprise.backupforge.model.RestoreResult;

/**
 * Interface para restauração de artefatos
 */
public interface IRestoreService {

    /**
     * Substitui o banco em uso pelo snapshot informado
     *
     * A troca é atômica e, em caso de falha, o arquivo original é recolocado.
     * A camada de acesso a dados não é reconectada: o resultado sempre indica
     * {@code requiresProcessRestart}.
     *
     * @param artifactPath Caminho do artefato de banco
     * @return Resultado da restauração
     * @throws com.seveninterprise.backupforge.exceptions.BackupException
     *         RESTORE_CONFLICT se houver outra operação de banco em andamento,
     *         ou o código da verificação que falhou
     */
    RestoreResult restoreDatabase(String artifactPath);

    /**
     * Extrai um backup de arquivos no diretório de destino
     *
     * Entradas que escapariam do destino ou estão corrompidas são ignoradas
     * e contadas em {@code skippedEntries}.
     *
     * @param artifactPath Caminho do artefato de arquivos
     * @param targetDir Destino; nulo usa {@code backup.files.base-directory}
     * @return Resultado com a quantidade de arquivos extraídos
     */
    RestoreResult restoreFiles(String artifactPath, String targetDir);
}
