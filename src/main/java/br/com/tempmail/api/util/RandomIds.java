package br.com.tempmail.api.util;

import java.security.SecureRandom;

public final class RandomIds {

    // Alfabeto dos IDs de tarefa (URL-safe)
    public static final String ID_ALPHABET =
            "_-0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    // Alfabeto da parte local dos e-mails: o mesmo, sem hífen (63 caracteres)
    public static final String LOCAL_PART_ALPHABET =
            "_0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final SecureRandom RANDOM = new SecureRandom();

    private RandomIds() {
    }

    public static String taskId() {
        return random(ID_ALPHABET, 16);
    }

    public static String localPart(int size) {
        return random(LOCAL_PART_ALPHABET, size);
    }

    public static String random(String alphabet, int size) {
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append(alphabet.charAt(RANDOM.nextInt(alphabet.length())));
        }
        return sb.toString();
    }
}
