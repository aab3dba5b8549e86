package io.iaf.operator.resources;

import io.iaf.operator.model.Application;
import io.iaf.operator.model.ApplicationSpec;
import io.iaf.operator.model.kpack.KpackImage;
import io.iaf.operator.model.kpack.KpackImageSpec;

/**
 * Desired kpack Image for an Application built from git or blob source.
 */
public final class KpackImages {
    public static final String BUILDER_KIND = "ClusterBuilder";

    private KpackImages() {
    }

    public static KpackImage image(Application app, String clusterBuilder, String registryPrefix,
                                   String serviceAccountName) {
        String name = app.getMetadata().getName();

        KpackImage image = new KpackImage();
        image.setApiVersion(KpackImage.GROUP + "/" + KpackImage.VERSION);
        image.setKind(KpackImage.KIND);
        image.setMetadata(ManagedResources.childMetadata(app, Application.KIND, name,
                ManagedResources.applicationLabels(name)));
        image.setSpec(KpackImageSpec.builder()
                .tag(registryPrefix + "/" + name)
                .builder(new KpackImageSpec.BuilderRef(BUILDER_KIND, clusterBuilder))
                .serviceAccountName(serviceAccountName)
                .source(source(app.getSpec()))
                .build());
        return image;
    }

    static KpackImageSpec.Source source(ApplicationSpec spec) {
        if (spec.hasGitSource()) {
            return new KpackImageSpec.Source(
                    new KpackImageSpec.Git(spec.getGit().getUrl(), spec.getGit().resolvedRevision()), null);
        }
        if (spec.hasBlobSource()) {
            return new KpackImageSpec.Source(null, new KpackImageSpec.Blob(spec.getBlob()));
        }
        return null;
    }
}
