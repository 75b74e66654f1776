/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.blueprint.core;

import java.io.FileWriter;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Журналирование движка в stderr и, опционально, в файл.
 *
 * Отладочный вывод включается переменной окружения BLUEPRINT_DEBUG=true.
 * Если задан BLUEPRINT_LOG_FILE, все сообщения дублируются в этот файл.
 * Предупреждения и ошибки печатаются в stderr всегда: stdout занят машинным отчетом.
 */
public final class EngineLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("BLUEPRINT_DEBUG"));

    private static final String LOG_FILE = System.getenv("BLUEPRINT_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (Exception e) {
                System.err.println("Log file disabled (" + LOG_FILE + "): " + e.getMessage());
            }
        }
    }

    private EngineLog() {
    }

    public static boolean isDebug() {
        return DEBUG;
    }

    public static void debug(String message) {
        toFile("DEBUG", message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    public static void warn(String message) {
        toFile("WARN", message);
        System.err.println("WARN: " + message);
    }

    public static void error(String message) {
        toFile("ERROR", message);
        System.err.println("ERROR: " + message);
    }

    private static void toFile(String level, String message) {
        if (logWriter != null) {
            synchronized (EngineLog.class) {
                logWriter.println("[" + LocalDateTime.now() + "] " + level + " " + message);
            }
        }
    }
}
