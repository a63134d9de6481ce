package io.shortshop.ecommerce.application.product;

import io.shortshop.ecommerce.application.product.dto.ImageRequest;
import io.shortshop.ecommerce.common.exception.BusinessException;
import io.shortshop.ecommerce.common.exception.ErrorCode;
import io.shortshop.ecommerce.domain.product.Product;
import io.shortshop.ecommerce.domain.product.ProductImage;
import io.shortshop.ecommerce.domain.product.ProductImageRepository;
import io.shortshop.ecommerce.domain.product.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductImageService {

    private final ProductRepository productRepository;
    private final ProductImageRepository imageRepository;

    /**
     * @return 추가된 이미지 수
     */
    @Transactional
    public int addImages(Long productId, List<ImageRequest> images) {
        log.info("Adding images to product: {}", productId);

        Product product = productRepository.findByIdOrThrow(productId);

        if (images == null || images.isEmpty()) {
            throw new BusinessException(ErrorCode.NO_IMAGES_PROVIDED);
        }

        for (ImageRequest image : images) {
            product.addImage(image.color(), image.imageUrl());
        }

        log.debug("Added {} image(s) to product: {}", images.size(), productId);
        return images.size();
    }

    /**
     * 해당 상품 소속 이미지만 삭제 가능
     */
    @Transactional
    public void deleteImage(Long productId, Long imageId) {
        log.info("Deleting image: {} of product: {}", imageId, productId);

        ProductImage image = imageRepository.findByIdAndProductId(imageId, productId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.IMAGE_NOT_FOUND,
                String.format("Image not found for this product. productId: %d, imageId: %d", productId, imageId)
            ));

        image.getProduct().removeImage(image);
    }
}
