/* 
 * Copyright (C) 2026 the SMEARGLE developers
 *
 * This File is part of SMEARGLE
 *
 * SMEARGLE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SMEARGLE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SMEARGLE.  If not, see <http://www.gnu.org/licenses/>.
 */
package smeargle.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.configuration.MaskingConfiguration;
import smeargle.data_structure.MaskCollection;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.plugins.Masker;
import smeargle.plugins.PluginFactory;
import smeargle.processing.GeometricMasks;
import smeargle.utils.MultipleException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs a list of maskers on images, stores each mask in a {@link MaskCollection} and synthesizes the final mask.
 * @author SMEARGLE developers
 */
public class MaskingPipeline {
    public final static Logger logger = LoggerFactory.getLogger(MaskingPipeline.class);
    final List<Masker> maskers;
    final boolean continueOnError;

    public MaskingPipeline(MaskingConfiguration configuration) {
        this(configuration.getMaskersToRun(), configuration.isContinueOnError());
    }

    public MaskingPipeline(boolean continueOnError, Masker... maskers) {
        this(Arrays.asList(maskers), continueOnError);
    }

    public MaskingPipeline(List<Masker> maskers, boolean continueOnError) {
        this.maskers = new ArrayList<>(maskers);
        this.continueOnError = continueOnError;
    }

    public List<Masker> getMaskers() {
        return Collections.unmodifiableList(maskers);
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public static class PipelineResult {
        final String imageName;
        final MaskCollection collection;
        final ImageByte mask;
        final MultipleException errors;
        PipelineResult(String imageName, MaskCollection collection, ImageByte mask, MultipleException errors) {
            this.imageName = imageName;
            this.collection = collection;
            this.mask = mask;
            this.errors = errors;
        }
        public String getImageName() {
            return imageName;
        }
        /**
         *
         * @return every mask computed for the image, keyed by the registry name of the masker that produced it
         */
        public MaskCollection getMaskCollection() {
            return collection;
        }
        /**
         *
         * @return union of all masks of the collection, null if the image could not be processed at all
         */
        public ImageByte getMask() {
            return mask;
        }
        /**
         *
         * @return failures recorded when the pipeline continues on error, empty otherwise
         */
        public MultipleException getErrors() {
            return errors;
        }
        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    /**
     * Runs all maskers on {@param image} with a new collection
     * @param image
     * @return result
     */
    public PipelineResult run(Image image) {
        return run(image, new MaskCollection());
    }

    /**
     * Runs all maskers on {@param image}, adding masks to {@param collection}. Masks already present in {@param collection} take part in the synthesis.
     * @param image
     * @param collection modified by this method
     * @return result
     * @throws SmeargleException first failure if the pipeline does not continue on error
     */
    public PipelineResult run(Image image, MaskCollection collection) {
        MultipleException errors = new MultipleException();
        logger.info("masking image: {} ({} masker(s))", image.getName(), maskers.size());
        for (Masker m : maskers) {
            String name = PluginFactory.getPluginName(m.getClass());
            try {
                String key = m.addTo(collection, image);
                logger.debug("image: {} masker: {} -> {} pixel(s) masked", image.getName(), key, collection.get(key).count());
            } catch (RuntimeException e) {
                if (!continueOnError) throw e;
                logger.warn("image: {} masker: {} failed: {}", image.getName(), name, e.getMessage());
                errors.addException(image.getName()+"/"+name, e);
            }
        }
        ImageByte mask;
        if (collection.isEmpty()) {
            logger.warn("image: {}: no mask computed, nothing is masked", image.getName());
            mask = GeometricMasks.maskNothing(image);
        } else mask = collection.synthesize();
        logger.info("image: {} -> {}/{} pixel(s) masked", image.getName(), mask.count(), mask.sizeXYZ());
        return new PipelineResult(image.getName(), collection, mask, errors);
    }

    /**
     * Processes each image independently, each with its own collection
     * @param images
     * @return one result per image, in the same order
     * @throws SmeargleException first failure if the pipeline does not continue on error
     */
    public List<PipelineResult> runAll(List<? extends Image> images) {
        List<PipelineResult> res = new ArrayList<>(images.size());
        int errorCount = 0;
        for (Image image : images) {
            PipelineResult r;
            try {
                r = run(image);
            } catch (RuntimeException e) {
                if (!continueOnError) throw e;
                logger.warn("image: {} could not be processed: {}", image.getName(), e.getMessage());
                MultipleException errors = new MultipleException();
                errors.addException(image.getName(), e);
                r = new PipelineResult(image.getName(), new MaskCollection(), null, errors);
            }
            if (r.hasErrors()) ++errorCount;
            res.add(r);
        }
        logger.info("processed {} image(s), {} with error(s)", images.size(), errorCount);
        return res;
    }
}
