package com.sparky.suppress.util;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

import java.net.IDN;
import java.util.Locale;

/**
 * Syntax-only email address checks. No DNS or deliverability lookups are made.
 */
public final class EmailAddressValidator {
    private static final int MAX_LOCAL_LENGTH = 64;
    private static final int MAX_ADDRESS_LENGTH = 254;
    private static final int MAX_LABEL_LENGTH = 63;

    private EmailAddressValidator() {}

    /**
     * Validates an address and returns its normalized (trimmed, lower-cased) form.
     * Normalizing an already normalized address returns it unchanged.
     *
     * @throws InvalidEmailAddressException with a human readable reason when the address is not well-formed
     */
    public static String normalize(String address) throws InvalidEmailAddressException {
        if (address == null || address.isBlank()) {
            throw new InvalidEmailAddressException("The email address is empty.");
        }
        String addr = address.trim();
        if (addr.length() > MAX_ADDRESS_LENGTH) {
            throw new InvalidEmailAddressException("The email address is too long.");
        }

        int at = addr.lastIndexOf('@');
        if (at < 0) {
            throw new InvalidEmailAddressException("The email address is not valid. It must have exactly one @-sign.");
        }
        String local = addr.substring(0, at);
        String domain = addr.substring(at + 1);

        checkLocalPart(local);
        String asciiAddr = local + "@" + checkDomain(domain);

        // RFC 822 syntax of the whole address, rejecting display names and groups
        try {
            InternetAddress parsed = new InternetAddress(asciiAddr, true);
            parsed.validate();
            if (parsed.getPersonal() != null || !asciiAddr.equals(parsed.getAddress())) {
                throw new InvalidEmailAddressException("The email address contains more than a bare address.");
            }
        } catch (AddressException e) {
            throw new InvalidEmailAddressException("The email address is not valid: " + e.getMessage());
        }

        return addr.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String address) {
        try {
            normalize(address);
            return true;
        } catch (InvalidEmailAddressException e) {
            return false;
        }
    }

    private static void checkLocalPart(String local) throws InvalidEmailAddressException {
        if (local.isEmpty()) {
            throw new InvalidEmailAddressException("There must be something before the @-sign.");
        }
        if (local.length() > MAX_LOCAL_LENGTH) {
            throw new InvalidEmailAddressException("The email address is too long before the @-sign.");
        }
        if (local.indexOf('@') >= 0) {
            throw new InvalidEmailAddressException("The email address is not valid. It must have exactly one @-sign.");
        }
        if (local.startsWith(".") || local.endsWith(".") || local.contains("..")) {
            throw new InvalidEmailAddressException("The part before the @-sign has a misplaced period.");
        }
        for (int i = 0; i < local.length(); i++) {
            char c = local.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new InvalidEmailAddressException("The part before the @-sign contains invalid characters.");
            }
        }
    }

    private static String checkDomain(String domain) throws InvalidEmailAddressException {
        if (domain.isEmpty()) {
            throw new InvalidEmailAddressException("There must be something after the @-sign.");
        }
        if (domain.charAt(0) == '[') {
            throw new InvalidEmailAddressException("Domain literals are not accepted.");
        }

        String ascii;
        try {
            ascii = IDN.toASCII(domain, IDN.USE_STD3_ASCII_RULES);
        } catch (IllegalArgumentException e) {
            throw new InvalidEmailAddressException("The domain name " + domain + " contains invalid characters.");
        }

        if (ascii.startsWith(".") || ascii.endsWith(".") || ascii.contains("..")) {
            throw new InvalidEmailAddressException("The domain name " + domain + " has a misplaced period.");
        }
        String[] labels = ascii.split("\\.");
        if (labels.length < 2) {
            throw new InvalidEmailAddressException("The part after the @-sign is not valid. It should have a period.");
        }
        for (String label : labels) {
            if (label.length() > MAX_LABEL_LENGTH) {
                throw new InvalidEmailAddressException("The domain name " + domain + " has a label that is too long.");
            }
        }
        String tld = labels[labels.length - 1];
        if (tld.chars().allMatch(Character::isDigit)) {
            throw new InvalidEmailAddressException("The domain name " + domain + " is not valid. It is not within a valid top-level domain.");
        }
        return ascii;
    }
}
