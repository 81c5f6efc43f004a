package com.yongkangl.nexus.io;

import com.yongkangl.nexus.model.Rooting;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

// Command comments between '=' and a tree expression: [&R], [&U], [&W 0.25] and free annotations.
class TreeCommands {
    private Rooting rooting;
    private Double weight;
    private final Map<String, String> annotations = new LinkedHashMap<>();

    TreeCommands(Rooting defaultRooting) {
        this.rooting = defaultRooting;
    }

    void read(NexusTokenizer tokenizer, boolean storeWeights) {
        while (tokenizer.peek().is(Token.Type.COMMENT)) {
            Token comment = tokenizer.next();
            String body = comment.getText().trim();
            Rooting stated = Rooting.fromCommand(body);
            if (stated != null) {
                rooting = stated;
            } else if (isWeight(body)) {
                if (storeWeights) {
                    weight = parseWeight(body.substring(2).trim(), comment);
                }
            } else {
                Annotations.parse(body, annotations);
            }
        }
    }

    private static boolean isWeight(String body) {
        return body.length() > 2 && (body.charAt(1) == 'W' || body.charAt(1) == 'w')
                && Character.isWhitespace(body.charAt(2));
    }

    // Either a plain number or a fraction such as 1/3, as written by PAUP and MrBayes.
    private static double parseWeight(String value, Token comment) {
        double weight;
        try {
            if (value.contains("/")) {
                String[] parts = StringUtils.split(value, '/');
                if (parts.length != 2) {
                    throw new NumberFormatException(value);
                }
                weight = Double.parseDouble(parts[0].trim()) / Double.parseDouble(parts[1].trim());
            } else {
                weight = Double.parseDouble(value);
            }
        } catch (NumberFormatException e) {
            throw new NexusSyntaxException("Malformed tree weight '" + value + "'", comment.getPosition());
        }
        if (!Double.isFinite(weight)) {
            throw new NexusSyntaxException("Tree weight '" + value + "' is not a finite number", comment.getPosition());
        }
        return weight;
    }

    Rooting getRooting() {
        return rooting;
    }

    Double getWeight() {
        return weight;
    }

    Map<String, String> getAnnotations() {
        return annotations;
    }
}
