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

package kinswing.Input;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import kinswing.Exceptions.MalformedInputException;
import kinswing.Types.PeptideRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits multi-mapped annotations, e.g. {@code Q1|GeneA;GeneB|S12;S40|PEPTIDE}, into one peptide per mapping.
 * Multi-valued fields with the same number of alternatives are paired up; otherwise all combinations are taken.
 */
public class CleanAnnotation {

    private static final Logger logger = LoggerFactory.getLogger(CleanAnnotation.class);

    public static final String defaultAnnotationDelimiter = "|";
    public static final String defaultSequenceSeparator = ";";

    private final List<PeptideRecord> cleanedList;

    public CleanAnnotation(List<PeptideRecord> peptideList) throws MalformedInputException {
        this(peptideList, defaultAnnotationDelimiter, defaultSequenceSeparator);
    }

    public CleanAnnotation(List<PeptideRecord> peptideList, String annotationDelimiter, String sequenceSeparator) throws MalformedInputException {
        Splitter fieldSplitter = Splitter.on(annotationDelimiter).trimResults();
        Splitter alternativeSplitter = Splitter.on(sequenceSeparator).trimResults().omitEmptyStrings();

        Map<String, PeptideRecord> annotationPeptideMap = new LinkedHashMap<>();
        for (PeptideRecord peptide : peptideList) {
            for (String annotation : expand(peptide.annotation, fieldSplitter, alternativeSplitter, annotationDelimiter)) {
                PeptideRecord existing = annotationPeptideMap.get(annotation);
                if (existing == null) {
                    annotationPeptideMap.put(annotation, peptide.withAnnotation(annotation));
                } else if (!existing.sequence.contentEquals(peptide.sequence)) {
                    throw new MalformedInputException("input_data", "annotation", String.format(Locale.US, "annotation %s maps to two sequences (%s and %s).", annotation, existing.sequence, peptide.sequence));
                } else if (Double.compare(existing.foldChange, peptide.foldChange) != 0 || Double.compare(existing.pValue, peptide.pValue) != 0) {
                    logger.warn("Annotation {} appears twice with different values (fold change {} and {}, p-value {} and {}). The first row is kept.", annotation, existing.foldChange, peptide.foldChange, existing.pValue, peptide.pValue);
                }
            }
        }
        cleanedList = ImmutableList.copyOf(annotationPeptideMap.values());
        logger.debug("{} peptides after cleaning {} annotations.", cleanedList.size(), peptideList.size());
    }

    static List<String> expand(String annotation, Splitter fieldSplitter, Splitter alternativeSplitter, String annotationDelimiter) {
        List<List<String>> fieldList = new ArrayList<>();
        Set<Integer> multiSizeSet = new HashSet<>();
        for (String field : fieldSplitter.split(annotation)) {
            List<String> alternatives = alternativeSplitter.splitToList(field);
            if (alternatives.isEmpty()) {
                alternatives = Collections.singletonList(field);
            }
            if (alternatives.size() > 1) {
                multiSizeSet.add(alternatives.size());
            }
            fieldList.add(alternatives);
        }

        if (multiSizeSet.isEmpty()) {
            List<String> parts = new ArrayList<>(fieldList.size());
            for (List<String> alternatives : fieldList) {
                parts.add(alternatives.get(0));
            }
            return Collections.singletonList(String.join(annotationDelimiter, parts));
        }

        List<String> output = new ArrayList<>();
        if (multiSizeSet.size() == 1) {
            int size = multiSizeSet.iterator().next();
            for (int i = 0; i < size; ++i) {
                List<String> parts = new ArrayList<>(fieldList.size());
                for (List<String> alternatives : fieldList) {
                    parts.add(alternatives.size() == 1 ? alternatives.get(0) : alternatives.get(i));
                }
                output.add(String.join(annotationDelimiter, parts));
            }
        } else {
            for (List<String> parts : Lists.cartesianProduct(fieldList)) {
                output.add(String.join(annotationDelimiter, parts));
            }
        }
        return output;
    }

    public List<PeptideRecord> returnCleanedList() {
        return cleanedList;
    }
}
