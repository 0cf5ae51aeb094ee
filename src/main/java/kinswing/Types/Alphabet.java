/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
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

package kinswing.Types;

import kinswing.Exceptions.InvalidAlphabetException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The 20 standard amino acids plus one wild card marking positions outside of the protein after centering on the
 * phosphosite. The wild card is not part of the alphabet: it has no index and never carries probability mass.
 */
public class Alphabet {

    public static final String RESIDUES = "ACDEFGHIKLMNPQRSTVWY";
    public static final int SIZE = RESIDUES.length();
    public static final char DEFAULT_WILD_CARD = '_';

    private static final int[] indexTable = new int[128];

    static {
        Arrays.fill(indexTable, -1);
        for (int i = 0; i < SIZE; ++i) {
            indexTable[RESIDUES.charAt(i)] = i;
        }
    }

    public final char wildCard;

    /**
     * @param wildCard any non amino acid symbol; letters are stored upper-case to match normalized sequences
     */
    public Alphabet(char wildCard) {
        if (index(Character.toUpperCase(wildCard)) >= 0) {
            throw new IllegalArgumentException(String.format(Locale.US, "The wild card (%c) cannot be an amino acid.", wildCard));
        }
        this.wildCard = Character.toUpperCase(wildCard);
    }

    public static int index(char residue) {
        if (residue < 128) {
            return indexTable[residue];
        } else {
            return -1;
        }
    }

    public static char residue(int index) {
        return RESIDUES.charAt(index);
    }

    public boolean isWildCard(char c) {
        return c == wildCard;
    }

    /**
     * Upper-cases the sequence and checks every symbol.
     *
     * @param recordId kinase or peptide id, used in the error message
     * @param sequence raw sequence
     * @return the upper-case sequence
     * @throws InvalidAlphabetException if a symbol is neither an amino acid nor the wild card
     */
    public String normalize(String recordId, String sequence) throws InvalidAlphabetException {
        String upper = sequence.toUpperCase(Locale.US);
        for (int i = 0; i < upper.length(); ++i) {
            char c = upper.charAt(i);
            if (index(c) < 0 && c != wildCard) {
                throw new InvalidAlphabetException(sequence.charAt(i), recordId, sequence);
            }
        }
        return upper;
    }

    /**
     * Residue indices of an aligned sequence, -1 at wild card positions.
     */
    public int[] encode(String alignedSequence) {
        int[] code = new int[alignedSequence.length()];
        for (int i = 0; i < code.length; ++i) {
            code[i] = index(alignedSequence.charAt(i));
        }
        return code;
    }
}
